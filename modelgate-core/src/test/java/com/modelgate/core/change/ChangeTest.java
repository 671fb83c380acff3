package com.modelgate.core.change;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Change 单元测试")
public class ChangeTest {

    private static Change change(String rev, String prev) {
        return Change.builder().modelName("Note").modelId("X").rev(rev).prev(prev).build();
    }

    @Nested
    @DisplayName("类型推导")
    class TypeTests {

        @Test
        @DisplayName("类型完全由 rev / prev 推导")
        void typeShouldDeriveFromRevAndPrev() {
            assertEquals(ChangeType.UPDATE, change("b", "a").type());
            assertEquals(ChangeType.CREATE, change("a", null).type());
            assertEquals(ChangeType.DELETE, change(null, "a").type());
            assertEquals(ChangeType.UNKNOWN, change(null, null).type());
        }

        @Test
        @DisplayName("修改 rev / prev 后类型随之变化")
        void typeShouldFollowFields() {
            Change c = change("a", null);
            c.setPrev("z");
            assertEquals(ChangeType.UPDATE, c.type());
            c.setRev(null);
            assertEquals(ChangeType.DELETE, c.type());
        }
    }

    @Nested
    @DisplayName("冲突判定")
    class ConflictTests {

        @Test
        @DisplayName("两个删除不冲突，删除与其他类型冲突")
        void deleteRules() {
            assertFalse(change(null, "a").conflictsWith(change(null, "b")));
            assertTrue(change(null, "a").conflictsWith(change("b", "a")));
            assertTrue(change("b", null).conflictsWith(change(null, "b")));
        }

        @Test
        @DisplayName("bothDeleted 只在两端都是 DELETE 时成立")
        void bothDeletedShouldRequireTwoDeletes() {
            assertTrue(Change.bothDeleted(change(null, "a"), change(null, "b")));
            assertFalse(Change.bothDeleted(change(null, "a"), change("b", "a")));
            assertFalse(Change.bothDeleted(change(null, null), change(null, "a")));
        }

        @Test
        @DisplayName("UPDATE 基于对方时不冲突")
        void updateBasedOnOtherShouldNotConflict() {
            assertFalse(change("c", "b").conflictsWith(change("b", "a")));
            assertTrue(change("c", "a").conflictsWith(change("b", "a")));
        }

        @Test
        @DisplayName("rev 不同的两个 CREATE 冲突")
        void independentCreatesShouldConflict() {
            assertTrue(change("a", null).conflictsWith(change("b", null)));
            assertFalse(change("a", null).conflictsWith(change("a", null)));
        }

        @Test
        @DisplayName("CREATE / UPDATE 只在一方基于另一方时不冲突")
        void createUpdatePairShouldRequireAncestry() {
            Change created = change("a", null);

            assertFalse(created.conflictsWith(change("b", "a")));
            assertTrue(created.conflictsWith(change("c", "x")));
        }

        @Test
        @DisplayName("conflictsWith 对称")
        void conflictsWithShouldBeSymmetric() {
            List<Change> samples = List.of(
                    change("a", null), change("b", null),
                    change("b", "a"), change("c", "a"), change("c", "b"),
                    change(null, "a"), change(null, "b"), change(null, null));
            for (Change x : samples) {
                for (Change y : samples) {
                    assertEquals(x.conflictsWith(y), y.conflictsWith(x), x + " vs " + y);
                }
            }
        }
    }

    @Test
    @DisplayName("自定义字段与固定字段一起存储并还原")
    void customPropertiesShouldRoundTripThroughData() {
        Change c = change("b", "a");
        c.setCheckpoint(3);
        c.getCustomProperties().put("tenantId", "t1");

        Map<String, Object> data = c.toData();
        assertEquals("t1", data.get("tenantId"));

        Change restored = Change.fromData(data);
        assertEquals(3L, restored.getCheckpoint());
        assertEquals("t1", restored.getCustomProperties().get("tenantId"));
        assertFalse(restored.getCustomProperties().containsKey("rev"));
    }
}
