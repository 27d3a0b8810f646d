package com.example.quorum.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DocumentType {
    NOTE, FILE, REPORT, REFLECTION, EMAIL, WEB, RECORD;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DocumentType fromValue(String value) {
        return EnumValues.parse(DocumentType.class, value, "document type");
    }
}
