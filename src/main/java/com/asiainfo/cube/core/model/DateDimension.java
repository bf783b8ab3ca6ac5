package com.asiainfo.cube.core.model;

import com.asiainfo.cube.core.CubeConstants;
import com.asiainfo.cube.core.exception.LoadException;
import com.asiainfo.cube.core.exception.UnknownFieldException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.asiainfo.cube.core.model.SqlNames.qualified;

/**
 * 时间维度
 * 维度表只存规范化日期文本（name 列：yyyy / yyyy-MM / yyyy-MM-dd），
 * year、yearmonth 为查询时由 name 计算的虚拟属性，不单独存储
 */
public class DateDimension extends CompoundDimension {

    public static final String NAME_ATTRIBUTE = "name";

    // yyyy, yyyy-MM, yyyy-MM-dd
    private static final Pattern ISO_PATTERN = Pattern.compile("(\\d{4})(?:-(\\d{2})(?:-(\\d{2}))?)?");

    public DateDimension(String name, String label, String description, boolean facet,
                         List<Attribute> extraAttributes) {
        super(name, label, description, facet, storedAttributes(extraAttributes));
    }

    private static List<Attribute> storedAttributes(List<Attribute> extraAttributes) {
        List<Attribute> stored = new ArrayList<>();
        stored.add(Attribute.of(NAME_ATTRIBUTE, DataType.STRING));
        for (Attribute attribute : extraAttributes) {
            String attr = attribute.name();
            if (!NAME_ATTRIBUTE.equals(attr) && !CubeConstants.TIME_LABELS.contains(attr)) {
                stored.add(attribute);
            }
        }
        return stored;
    }

    @Override
    public FieldType type() {
        return FieldType.DATE;
    }

    @Override
    public boolean isDerived(String attribute) {
        return CubeConstants.TIME_LABELS.contains(attribute);
    }

    @Override
    public String derivedExpression(String attribute, String alias) {
        String column = qualified(alias, NAME_ATTRIBUTE);
        return switch (attribute) {
            case CubeConstants.YEAR -> "substr(" + column + ", 1, 4)";
            case CubeConstants.YEARMONTH -> "CASE WHEN length(" + column + ") >= 7 THEN substr("
                    + column + ", 1, 4) || substr(" + column + ", 6, 2) END";
            default -> throw new UnknownFieldException(name + "." + attribute);
        };
    }

    @Override
    protected Map<String, Object> extractAttributes(Object raw) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(NAME_ATTRIBUTE, canonicalDate(raw));
        Map<?, ?> data = raw instanceof Map<?, ?> map ? map : Map.of();
        for (Attribute attribute : attributes()) {
            if (!NAME_ATTRIBUTE.equals(attribute.name())) {
                values.put(attribute.name(), attributeValue(attribute, data));
            }
        }
        return values;
    }

    /**
     * 规范化日期：支持 ISO 文本、年份数字、LocalDate、{name: ...} 或 {year, month, day}
     */
    String canonicalDate(Object raw) {
        if (raw instanceof LocalDate date) {
            return date.toString();
        }
        if (raw instanceof Number number) {
            return canonicalDate(String.valueOf(number.longValue()));
        }
        if (raw instanceof Map<?, ?> map) {
            if (map.get(NAME_ATTRIBUTE) != null) {
                return canonicalDate(map.get(NAME_ATTRIBUTE));
            }
            if (map.get(CubeConstants.YEAR) == null) {
                throw new LoadException(name, "Date dimension '" + name + "' needs a name or a year: " + raw);
            }
            return fromParts(map.get(CubeConstants.YEAR), map.get("month"), map.get("day"));
        }
        if (raw instanceof String text) {
            Matcher matcher = ISO_PATTERN.matcher(text.trim());
            if (matcher.matches()) {
                return fromParts(matcher.group(1), matcher.group(2), matcher.group(3));
            }
        }
        throw new LoadException(name, "Date dimension '" + name + "' cannot parse date: " + raw);
    }

    private String fromParts(Object year, Object month, Object day) {
        try {
            int y = Integer.parseInt(String.valueOf(year).trim());
            if (y < 0 || y > 9999) {
                throw new LoadException(name, "Year out of range: " + year);
            }
            if (month == null) {
                return String.format("%04d", y);
            }
            int m = Integer.parseInt(String.valueOf(month).trim());
            if (day == null) {
                return YearMonth.of(y, m).toString();
            }
            int d = Integer.parseInt(String.valueOf(day).trim());
            return LocalDate.of(y, m, d).toString();
        } catch (NumberFormatException | DateTimeException e) {
            throw new LoadException(name, String.format("Invalid date parts for '%s': year=%s, month=%s, day=%s",
                    name, year, month, day), e);
        }
    }

    /**
     * 由 name 推导 year / yearmonth，与 derivedExpression 的 SQL 计算保持一致
     */
    @Override
    public Map<String, Object> decorate(Map<String, Object> decoded) {
        Object value = decoded.get(NAME_ATTRIBUTE);
        if (value instanceof String date && date.length() >= 4) {
            decoded.putIfAbsent(CubeConstants.YEAR, date.substring(0, 4));
            decoded.putIfAbsent(CubeConstants.YEARMONTH,
                    date.length() >= 7 ? date.substring(0, 4) + date.substring(5, 7) : null);
        }
        return decoded;
    }
}
