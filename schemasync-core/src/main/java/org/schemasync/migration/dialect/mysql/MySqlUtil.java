package org.schemasync.migration.dialect.mysql;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * MySQL data type knowledge: the known base types and which type changes narrow the value range.
 */
public final class MySqlUtil {

    private MySqlUtil() {}

    private static final Set<String> DATA_TYPES = Set.of(
            // numeric
            "tinyint", "smallint", "mediumint", "int", "integer", "bigint",
            "decimal", "numeric", "float", "double", "bit",
            // string
            "char", "varchar", "binary", "varbinary",
            "tinyblob", "blob", "mediumblob", "longblob",
            "tinytext", "text", "mediumtext", "longtext",
            // date and time
            "date", "time", "datetime", "timestamp", "year",
            "json", "enum", "set",
            // spatial
            "geometry", "point", "linestring", "polygon",
            "multipoint", "multilinestring", "multipolygon", "geometrycollection");

    private static final Set<String> INDEX_TYPES = Set.of("BTREE", "HASH", "RTREE", "FULLTEXT");

    private static final Map<String, List<String>> NARROWING = Map.of(
            "text", List.of("varchar", "char", "tinytext"),
            "longtext", List.of("text", "mediumtext", "tinytext", "varchar", "char"),
            "mediumtext", List.of("text", "tinytext", "varchar", "char"),
            "bigint", List.of("int", "integer", "mediumint", "smallint", "tinyint"),
            "int", List.of("mediumint", "smallint", "tinyint"),
            "integer", List.of("mediumint", "smallint", "tinyint"),
            "mediumint", List.of("smallint", "tinyint"),
            "smallint", List.of("tinyint"),
            "double", List.of("float"));

    /**
     * Lower-case type name without length, precision or modifiers: {@code VARCHAR(255)} gives {@code varchar},
     * {@code INT UNSIGNED} gives {@code int}.
     */
    public static String baseType(String dataType) {
        if (dataType == null) {
            return "";
        }
        String t = dataType.trim().toLowerCase(Locale.ROOT);
        int paren = t.indexOf('(');
        if (paren >= 0) {
            t = t.substring(0, paren);
        }
        int space = t.indexOf(' ');
        if (space >= 0) {
            t = t.substring(0, space);
        }
        return t.trim();
    }

    public static boolean isKnownDataType(String dataType) {
        return DATA_TYPES.contains(baseType(dataType));
    }

    public static boolean isKnownIndexType(String indexType) {
        return indexType == null || indexType.isBlank() || INDEX_TYPES.contains(indexType.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * True when changing {@code oldType} to {@code newType} may truncate existing values: a narrower base type,
     * or the same base type with a smaller declared length.
     */
    public static boolean isNarrowing(String oldType, String newType) {
        String oldBase = baseType(oldType);
        String newBase = baseType(newType);
        if (NARROWING.getOrDefault(oldBase, List.of()).contains(newBase)) {
            return true;
        }
        if (oldBase.equals(newBase)) {
            Integer oldLen = declaredLength(oldType);
            Integer newLen = declaredLength(newType);
            return oldLen != null && newLen != null && newLen < oldLen;
        }
        return false;
    }

    /**
     * First number inside the parentheses, e.g. 255 for {@code VARCHAR(255)}; null when absent or not numeric.
     */
    static Integer declaredLength(String dataType) {
        if (dataType == null) {
            return null;
        }
        int open = dataType.indexOf('(');
        int close = dataType.indexOf(')', open + 1);
        if (open < 0 || close < 0) {
            return null;
        }
        String inner = dataType.substring(open + 1, close);
        int comma = inner.indexOf(',');
        if (comma >= 0) {
            inner = inner.substring(0, comma);
        }
        try {
            return Integer.parseInt(inner.trim());
        } catch (NumberFormatException e) {
            // enum/set value lists
            return null;
        }
    }
}
