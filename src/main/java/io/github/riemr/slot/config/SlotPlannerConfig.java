package io.github.riemr.slot.config;

import io.github.riemr.slot.domain.model.BreakPattern;
import io.github.riemr.slot.optimization.entity.PriorityPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;

@Configuration
@Slf4j
public class SlotPlannerConfig {

    // 1 スロットの長さ（既定: 25分）
    @Value("${slot.planner.slot-length:PT25M}")
    private String slotLength;
    // priority の向き。LOWER_VALUE_FIRST は 1 が最優先
    @Value("${slot.planner.priority-policy:LOWER_VALUE_FIRST}")
    private String priorityPolicy;
    @Value("${slot.planner.shuffle.enabled:true}")
    private boolean shuffleEnabled;
    // スコア最大化シャッフルの時間上限と試行回数上限
    @Value("${slot.planner.shuffle.time-limit:PT0.2S}")
    private String shuffleTimeLimit;
    @Value("${slot.planner.shuffle.max-attempts:200}")
    private int shuffleMaxAttempts;
    // ポモドーロ式の休憩（既定: 無効。有効時は 4 スロットごとに長休憩）
    @Value("${slot.planner.breaks.enabled:false}")
    private boolean breaksEnabled;
    @Value("${slot.planner.break-interval:4}")
    private int breakInterval;
    @Value("${slot.planner.short-break:PT5M}")
    private String shortBreak;
    @Value("${slot.planner.long-break:PT30M}")
    private String longBreak;

    @Bean
    public SlotPlannerSettings slotPlannerSettings() {
        SlotPlannerSettings settings = new SlotPlannerSettings(
                parseDurationTolerant("slot-length", slotLength, SlotPlannerSettings.DEFAULT_SLOT_LENGTH),
                parsePolicyTolerant(priorityPolicy),
                shuffleEnabled,
                parseDurationTolerant("shuffle.time-limit", shuffleTimeLimit, SlotPlannerSettings.DEFAULT_SHUFFLE_TIME_LIMIT),
                positiveOrDefault("shuffle.max-attempts", shuffleMaxAttempts, SlotPlannerSettings.DEFAULT_SHUFFLE_MAX_ATTEMPTS),
                breaksEnabled ? breakPattern() : BreakPattern.NONE);
        log.info("Slot planner settings: {}", settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private BreakPattern breakPattern() {
        BreakPattern def = SlotPlannerSettings.DEFAULT_BREAK_PATTERN;
        return new BreakPattern(
                positiveOrDefault("break-interval", breakInterval, def.breakInterval()),
                parseDurationTolerant("short-break", shortBreak, def.shortBreak()),
                parseDurationTolerant("long-break", longBreak, def.longBreak()));
    }

    static int positiveOrDefault(String key, int value, int def) {
        if (value > 0) return value;
        log.warn("slot.planner.{}={} is not positive, using {}", key, value, def);
        return def;
    }

    static Duration parseDurationTolerant(String key, String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim();
        try {
            Duration d;
            if (s.startsWith("P")) {
                if (s.matches("^PT\\d+$")) s = s + "S"; // fix common mistake
                d = Duration.parse(s);
            } else {
                String ls = s.toLowerCase();
                if (ls.endsWith("ms")) d = Duration.ofMillis(Long.parseLong(ls.substring(0, ls.length() - 2)));
                else if (ls.endsWith("s")) d = Duration.ofSeconds(Long.parseLong(ls.substring(0, ls.length() - 1)));
                else if (ls.endsWith("m")) d = Duration.ofMinutes(Long.parseLong(ls.substring(0, ls.length() - 1)));
                else if (ls.endsWith("h")) d = Duration.ofHours(Long.parseLong(ls.substring(0, ls.length() - 1)));
                else d = Duration.ofSeconds(Long.parseLong(ls));
            }
            if (d.isNegative() || d.isZero()) {
                log.warn("slot.planner.{}={} is not positive, using {}", key, raw, def);
                return def;
            }
            return d;
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("slot.planner.{}={} could not be parsed, using {}", key, raw, def);
            return def;
        }
    }

    static PriorityPolicy parsePolicyTolerant(String raw) {
        try {
            return PriorityPolicy.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("slot.planner.priority-policy={} is unknown, using {}", raw, PriorityPolicy.LOWER_VALUE_FIRST);
            return PriorityPolicy.LOWER_VALUE_FIRST;
        }
    }
}
