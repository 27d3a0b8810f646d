package com.example.quorum.repository;

import com.example.quorum.domain.Setting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SettingRepository extends JpaRepository<Setting, String> {

    List<Setting> findByKeyStartingWithOrderByKeyAsc(String prefix);
}
