package com.minipivot.backend.field;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.minipivot.backend.aggregator.AggregateFunc;
import com.minipivot.backend.record.Dataset;
import com.minipivot.backend.record.Record;
import com.minipivot.backend.utils.Numbers;

/**
 * 字段类型推断：对前若干条记录采样，80% 以上的值为有限数值则视为数值字段，
 * 80% 以上的值形如日期且年份在 [1900, 2100] 内则视为日期字段。
 */
public class FieldInspector {

    public static final double THRESHOLD = 0.8;
    public static final int DEFAULT_SAMPLE_SIZE = 1000;

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})[-/](\\d{2})[-/](\\d{2})");
    private static final Pattern DAY_FIRST = Pattern.compile("^(\\d{1,2})[-/](\\d{1,2})[-/](\\d{4})");
    private static final Pattern DAY_MONTH_NAME = Pattern.compile(
            "^(\\d{1,2})\\s+(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?,?\\s+(\\d{4})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final DateTimeFormatter MONTH_NAME = DateTimeFormatter.ofPattern("MMM", Locale.ENGLISH);

    private final int sampleSize;

    public FieldInspector() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    public FieldInspector(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    /**
     * 推断每个字段的角色，字段顺序与第一条记录一致。
     */
    public Map<String, FieldRole> inspect(Dataset dataset) {
        Map<String, FieldRole> roles = new LinkedHashMap<>();
        if(dataset.isEmpty()) {
            return roles;
        }
        List<Record> sample = dataset.records().subList(0, Math.min(dataset.size(), sampleSize));
        for (String field : dataset.fields()) {
            int numeric = 0;
            int date = 0;
            for (Record r : sample) {
                Object v = r.get(field);
                if(Numbers.looksNumeric(v)) {
                    numeric++;
                }
                if(isLikelyDate(v)) {
                    date++;
                }
            }
            if(numeric >= THRESHOLD * sample.size()) {
                roles.put(field, FieldRole.NUMERIC);
            } else if(date >= THRESHOLD * sample.size()) {
                roles.put(field, FieldRole.DATE);
            } else {
                roles.put(field, FieldRole.TEXT);
            }
        }
        return roles;
    }

    public List<String> numericFields(Dataset dataset) {
        return fieldsOf(inspect(dataset), FieldRole.NUMERIC);
    }

    public List<String> dateFields(Dataset dataset) {
        return fieldsOf(inspect(dataset), FieldRole.DATE);
    }

    public static List<String> fieldsOf(Map<String, FieldRole> roles, FieldRole role) {
        List<String> out = new ArrayList<>();
        roles.forEach((f, r) -> {
            if(r == role) {
                out.add(f);
            }
        });
        return out;
    }

    /** 非数值字段只支持 COUNT */
    public static Set<AggregateFunc> allowedAggregates(FieldRole role) {
        Set<AggregateFunc> allowed = EnumSet.noneOf(AggregateFunc.class);
        for (AggregateFunc func : AggregateFunc.values()) {
            if(role == FieldRole.NUMERIC || !func.requiresNumeric()) {
                allowed.add(func);
            }
        }
        return allowed;
    }

    /** 拖入值区域时的默认聚合：数值字段 SUM，其它 COUNT */
    public static AggregateFunc defaultAggregate(FieldRole role) {
        return role == FieldRole.NUMERIC ? AggregateFunc.SUM : AggregateFunc.COUNT;
    }

    /**
     * 判断值是否形如日期。纯数字或长度小于 6 的字符串不视为日期。
     */
    public static boolean isLikelyDate(Object value) {
        if(value == null) {
            return false;
        }
        String s = value.toString().trim();
        if(s.length() < 6 || DIGITS.matcher(s).matches()) {
            return false;
        }
        try {
            Matcher m = ISO_DATE.matcher(s);
            if(m.find()) {
                return validDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
            }
            m = DAY_FIRST.matcher(s);
            if(m.find()) {
                int a = Integer.parseInt(m.group(1));
                int b = Integer.parseInt(m.group(2));
                int year = Integer.parseInt(m.group(3));
                // 日/月顺序不确定，任一解释合法即可
                return validDate(year, b, a) || validDate(year, a, b);
            }
            m = DAY_MONTH_NAME.matcher(s);
            if(m.find()) {
                int month = MONTH_NAME.parse(capitalize(m.group(2).substring(0, 3)))
                        .get(ChronoField.MONTH_OF_YEAR);
                return validDate(Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(1)));
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            return false;
        }
        return false;
    }

    private static boolean validDate(int year, int month, int day) {
        if(year < 1900 || year > 2100) {
            return false;
        }
        try {
            LocalDate.of(year, month, day);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    private static String capitalize(String s) {
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
