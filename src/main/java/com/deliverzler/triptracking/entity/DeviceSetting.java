package com.deliverzler.triptracking.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Key/value device preference that outlives trips and restarts (e.g. drive mode).
 */
@Entity
@Table(name = "device_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceSetting {

    @Id
    @Column(name = "setting_key", length = 64)
    private String key;

    @Column(name = "setting_value", nullable = false)
    private String value;
}
