package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.SystemSetting;
import com.sandy.fleet.health.repository.SystemSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Runtime-tunable key/value settings (feature flags, anomaly thresholds).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SettingsService {

    public static final String ALERT_EMAIL_ENABLED = "alert_email_enabled";
    public static final String ALERT_SMS_ENABLED = "alert_sms_enabled";
    public static final String HOUR_ANOMALY_PREFIX = "hour_anomaly_";
    public static final String HOUR_ANOMALY_JUMP_THRESHOLD = HOUR_ANOMALY_PREFIX + "jumpThreshold";

    private final SystemSettingRepository settingRepository;
    private final Clock clock;

    public Optional<String> get(String key) {
        return settingRepository.findById(key).map(SystemSetting::getValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return get(key).map(v -> "true".equalsIgnoreCase(v.trim())).orElse(defaultValue);
    }

    public double getDouble(String key, double defaultValue) {
        Optional<String> raw = get(key);
        if (raw.isEmpty()) return defaultValue;
        try {
            return Double.parseDouble(raw.get().trim());
        } catch (NumberFormatException e) {
            log.warn("Setting {} has non-numeric value '{}', using default {}", key, raw.get(), defaultValue);
            return defaultValue;
        }
    }

    @Transactional
    public SystemSetting set(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Setting key is required");
        }
        SystemSetting setting = settingRepository.findById(key)
                .orElseGet(() -> SystemSetting.builder().key(key).build());
        setting.setValue(value);
        setting.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Setting updated key={} value={}", key, value);
        return settingRepository.save(setting);
    }
}
