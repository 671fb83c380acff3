package com.modelgate.core.store;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 查询条件
 * <p>
 * 条件之间为 AND；{@link #or(Where...)} 追加一组 OR 子条件。
 * 值比较时数字按数值比较，其余类型不一致时按字符串形式比较 (ID 常以字符串/数字两种形式出现)。
 * </p>
 */
public final class Where {

    public enum Op {
        EQ, NEQ, INQ, GT, GTE, LT, LTE
    }

    public record Condition(String field, Op op, Object value) {
    }

    private final List<Condition> conditions = new ArrayList<>();
    private final List<List<Where>> orGroups = new ArrayList<>();

    public static Where create() {
        return new Where();
    }

    public static Where eq(String field, Object value) {
        return new Where().and(field, Op.EQ, value);
    }

    public static Where inq(String field, Collection<?> values) {
        return new Where().and(field, Op.INQ, new ArrayList<>(values));
    }

    public static Where all() {
        return new Where();
    }

    public Where and(String field, Op op, Object value) {
        conditions.add(new Condition(field, op, value));
        return this;
    }

    public Where andEq(String field, Object value) {
        return and(field, Op.EQ, value);
    }

    public Where andInq(String field, Collection<?> values) {
        return and(field, Op.INQ, new ArrayList<>(values));
    }

    public Where or(Where... alternatives) {
        orGroups.add(List.of(alternatives));
        return this;
    }

    /**
     * 合并另一组条件 (AND)
     */
    public Where merge(Where other) {
        if (other != null) {
            conditions.addAll(other.conditions);
            orGroups.addAll(other.orGroups);
        }
        return this;
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public boolean isEmpty() {
        return conditions.isEmpty() && orGroups.isEmpty();
    }

    public boolean matches(Map<String, Object> doc) {
        for (Condition c : conditions) {
            if (!test(c, doc.get(c.field()))) {
                return false;
            }
        }
        for (List<Where> group : orGroups) {
            boolean any = false;
            for (Where alternative : group) {
                if (alternative.matches(doc)) {
                    any = true;
                    break;
                }
            }
            if (!any) {
                return false;
            }
        }
        return true;
    }

    private static boolean test(Condition c, Object actual) {
        return switch (c.op()) {
            case EQ -> valueEquals(actual, c.value());
            case NEQ -> !valueEquals(actual, c.value());
            case INQ -> ((Collection<?>) c.value()).stream().anyMatch(candidate -> valueEquals(actual, candidate));
            case GT -> actual != null && c.value() != null && compare(actual, c.value()) > 0;
            case GTE -> actual != null && c.value() != null && compare(actual, c.value()) >= 0;
            case LT -> actual != null && c.value() != null && compare(actual, c.value()) < 0;
            case LTE -> actual != null && c.value() != null && compare(actual, c.value()) <= 0;
        };
    }

    static boolean valueEquals(Object a, Object b) {
        if (Objects.equals(a, b)) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return toDecimal(na).compareTo(toDecimal(nb)) == 0;
        }
        return a.toString().equals(b.toString());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return toDecimal(na).compareTo(toDecimal(nb));
        }
        if (a instanceof Comparable ca && a.getClass().isInstance(b)) {
            return ca.compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static BigDecimal toDecimal(Number n) {
        return n instanceof BigDecimal bd ? bd : new BigDecimal(n.toString());
    }

    @Override
    public String toString() {
        return "Where{" + conditions + (orGroups.isEmpty() ? "" : ", or=" + orGroups) + "}";
    }
}
