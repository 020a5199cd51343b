package com.deliverzler.triptracking.repository;

import com.deliverzler.triptracking.entity.DeviceSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeviceSettingRepository extends JpaRepository<DeviceSetting, String> {
}
