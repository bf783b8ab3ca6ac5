package com.asiainfo.cube.core;

import java.util.Set;
import java.util.regex.Pattern;

public class CubeConstants {
    // 数据集名、字段名、属性名：字母数字、下划线、中划线（不允许 "."，"." 用于组合键）
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z0-9_\\-]+");

    // 物理表名 = {dataset}__{suffix}
    public static final String TABLE_SEPARATOR = "__";
    public static final String FACT_TABLE_SUFFIX = "entry";

    // 事实表别名
    public static final String FACT_ALIAS = "entry";
    public static final String ID_COLUMN = "id";
    public static final String FOREIGN_KEY_SUFFIX = "_id";

    // 未指定 default_time 时的默认时间维度名
    public static final String TIME_DIMENSION = "time";

    // 时间维度派生字段
    public static final String YEAR = "year";
    public static final String YEARMONTH = "yearmonth";
    public static final Set<String> TIME_LABELS = Set.of(YEAR, YEARMONTH);

    // 结果字段
    public static final String DEFAULT_MEASURE = "amount";
    public static final String NUM_ENTRIES = "num_entries";

    // 内容哈希版本，修改编码规则时必须升级
    public static final String HASH_VERSION = "cube-hash-v1";

    private CubeConstants() {}
}
