package com.hao.ntpgateway.core.query;

import exception.InvalidTimestampException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 时间字面量解析工具
 * <p>
 * 统一把宿主字面量与行时间戳折算为 UTC Instant，精度截断到微秒。
 *
 * @author hli
 * @date 2026-10-18
 */
public final class TimestampLiterals {

    /**
     * 依次尝试：带偏移量的 RFC 3339、无偏移量的本地时间（按 UTC）、纯日期（UTC 零点）
     */
    private static final List<Function<String, Instant>> LITERAL_PARSERS = List.of(
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private TimestampLiterals() {
    }

    /**
     * 将条件字面量转为 Instant
     * <p>
     * 无时区信息的取值一律按 UTC 解释。
     *
     * @param value 字面量
     * @return UTC 时间点
     * @throws InvalidTimestampException 类型不支持或字符串无法解析
     */
    public static Instant toInstant(Object value) {
        Instant instant;
        if (value instanceof Instant i) {
            instant = i;
        } else if (value instanceof OffsetDateTime odt) {
            instant = odt.toInstant();
        } else if (value instanceof ZonedDateTime zdt) {
            instant = zdt.toInstant();
        } else if (value instanceof LocalDateTime ldt) {
            instant = ldt.toInstant(ZoneOffset.UTC);
        } else if (value instanceof LocalDate ld) {
            instant = ld.atStartOfDay(ZoneOffset.UTC).toInstant();
        } else if (value instanceof String s) {
            instant = parseLiteral(s);
        } else {
            String type = value == null ? "null" : value.getClass().getSimpleName();
            throw new InvalidTimestampException("Unsupported timestamp literal type: " + type);
        }
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * 解析行时间戳（RFC 3339，允许空格分隔日期与时间），与条件边界一样截断到微秒
     *
     * @param text 行时间戳
     * @return 解析失败返回空
     */
    public static Optional<Instant> parseRowTimestamp(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(normalizeSeparator(text.trim()),
                    DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant().truncatedTo(ChronoUnit.MICROS));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Instant parseLiteral(String raw) {
        String text = normalizeSeparator(raw.trim());
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : LITERAL_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new InvalidTimestampException("Invalid timestamp literal: '" + raw + "'", last);
    }

    private static String normalizeSeparator(String text) {
        if (text.length() > 10 && text.charAt(10) == ' ') {
            return text.substring(0, 10) + 'T' + text.substring(11);
        }
        return text;
    }
}
