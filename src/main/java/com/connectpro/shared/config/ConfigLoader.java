package com.connectpro.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    static final String DEFAULT_FOOTER = "This Bot was made using @Connectsprobot";

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".connectpro", "config.yaml"
    );

    public static RelayConfig load() {
        return load(DEFAULT_PATH);
    }

    public static RelayConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static RelayConfig load(Path path, java.util.function.Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var frontDoor = (Map<String, Object>) raw.getOrDefault("front-door", Map.of());
        var store = (Map<String, Object>) raw.getOrDefault("store", Map.of());
        var db = (Map<String, Object>) raw.getOrDefault("database", Map.of());
        var footer = (Map<String, Object>) raw.getOrDefault("footer", Map.of());
        var policy = (Map<String, Object>) raw.getOrDefault("policy", Map.of());
        var timeouts = (Map<String, Object>) raw.getOrDefault("timeouts", Map.of());
        var retention = (Map<String, Object>) raw.getOrDefault("retention", Map.of());
        var trialSweep = (Map<String, Object>) raw.getOrDefault("trial-sweep", Map.of());
        var dispatch = (Map<String, Object>) raw.getOrDefault("dispatch", Map.of());

        return new RelayConfig(
            envOrDefault(env, "CONNECTPRO_BOT_TOKEN",
                String.valueOf(frontDoor.getOrDefault("bot-token", ""))),
            String.valueOf(frontDoor.getOrDefault("bot-username", "connectsprobot")),
            String.valueOf(store.getOrDefault("type", "postgres")),
            Map.of(
                "url", envOrDefault(env, "CONNECTPRO_DB_URL",
                    String.valueOf(db.getOrDefault("url", "jdbc:postgresql://localhost:5432/connectpro"))),
                "username", envOrDefault(env, "CONNECTPRO_DB_USER",
                    String.valueOf(db.getOrDefault("username", "connectpro"))),
                "password", envOrDefault(env, "CONNECTPRO_DB_PASS",
                    String.valueOf(db.getOrDefault("password", "connectpro")))
            ),
            parseAdminIds(env.apply("CONNECTPRO_ADMIN_IDS"), raw.getOrDefault("admin-ids", List.of())),
            String.valueOf(footer.getOrDefault("text", DEFAULT_FOOTER)),
            parsePolicyConfig(policy),
            parseTimeoutsConfig(timeouts),
            new ScheduleConfig(
                intOf(retention, "message-days", ScheduleConfig.defaults().retentionDays()),
                String.valueOf(retention.getOrDefault("cron", ScheduleConfig.defaults().retentionCron())),
                String.valueOf(trialSweep.getOrDefault("cron", ScheduleConfig.defaults().trialSweepCron()))
            ),
            intOf(dispatch, "lanes", 8)
        );
    }

    @SuppressWarnings("unchecked")
    private static PolicyConfig parsePolicyConfig(Map<String, Object> policy) {
        var defaults = PolicyConfig.defaults();
        var warnings = policy.containsKey("trial-warning-days")
                ? ((List<Object>) policy.get("trial-warning-days")).stream()
                        .map(v -> Integer.parseInt(String.valueOf(v))).toList()
                : defaults.trialWarningDays();
        return new PolicyConfig(
            intOf(policy, "daily-message-limit", defaults.dailyMessageLimit()),
            intOf(policy, "start-hour", defaults.startHour()),
            intOf(policy, "end-hour", defaults.endHour()),
            intOf(policy, "end-minute", defaults.endMinute()),
            intOf(policy, "trial-days", defaults.trialDays()),
            ZoneId.of(String.valueOf(policy.getOrDefault("zone", defaults.zone().getId()))),
            warnings
        );
    }

    private static TimeoutsConfig parseTimeoutsConfig(Map<String, Object> timeouts) {
        var defaults = TimeoutsConfig.defaults();
        return new TimeoutsConfig(
            Duration.ofMillis(longOf(timeouts, "store-ms", defaults.store().toMillis())),
            Duration.ofMillis(longOf(timeouts, "transport-ms", defaults.transport().toMillis())),
            Duration.ofMillis(longOf(timeouts, "drain-ms", defaults.drain().toMillis()))
        );
    }

    private static List<Long> parseAdminIds(String fromEnv, Object fromYaml) {
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Arrays.stream(fromEnv.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Long::parseLong)
                    .toList();
        }
        if (fromYaml instanceof List<?> list) {
            return list.stream().map(v -> Long.parseLong(String.valueOf(v))).toList();
        }
        return List.of();
    }

    private static int intOf(Map<String, Object> section, String key, int fallback) {
        return Integer.parseInt(String.valueOf(section.getOrDefault(key, fallback)));
    }

    private static long longOf(Map<String, Object> section, String key, long fallback) {
        return Long.parseLong(String.valueOf(section.getOrDefault(key, fallback)));
    }

    private static String envOrDefault(java.util.function.Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
