package com.deliverzler.triptracking.service;

import com.deliverzler.triptracking.entity.DeviceSetting;
import com.deliverzler.triptracking.model.DriveMode;
import com.deliverzler.triptracking.repository.DeviceSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persisted drive mode. Defaults to NORMAL until the driver picks one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriveModeService {

    static final String SETTING_KEY = "drive_mode";

    private final DeviceSettingRepository deviceSettingRepository;

    private volatile DriveMode cached;

    @Transactional(readOnly = true)
    public DriveMode getDriveMode() {
        DriveMode mode = cached;
        if (mode == null) {
            mode = deviceSettingRepository.findById(SETTING_KEY)
                    .map(DeviceSetting::getValue)
                    .map(this::parse)
                    .orElse(DriveMode.NORMAL);
            cached = mode;
        }
        return mode;
    }

    @Transactional
    public DriveMode setDriveMode(DriveMode mode) {
        deviceSettingRepository.save(new DeviceSetting(SETTING_KEY, mode.name()));
        cached = mode;
        log.info("Drive mode set to {}", mode);
        return mode;
    }

    private DriveMode parse(String value) {
        try {
            return DriveMode.valueOf(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown stored drive mode '{}', using NORMAL", value);
            return DriveMode.NORMAL;
        }
    }
}
