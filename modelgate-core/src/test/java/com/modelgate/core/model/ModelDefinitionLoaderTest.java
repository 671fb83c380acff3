package com.modelgate.core.model;

import com.modelgate.api.security.AccessType;
import com.modelgate.api.security.Permission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModelDefinitionLoader 单元测试")
public class ModelDefinitionLoaderTest {

    private static List<ModelDefinition> loadFixture() throws IOException {
        try (InputStream in = ModelDefinitionLoaderTest.class.getResourceAsStream("/models/account.yml")) {
            assertNotNull(in);
            return ModelDefinitionLoader.load(in);
        }
    }

    @Test
    @DisplayName("一个文件中的多个模型都被加载")
    void shouldLoadEveryDocument() throws IOException {
        List<ModelDefinition> definitions = loadFixture();

        assertEquals(2, definitions.size());
        assertEquals("Account", definitions.get(0).getName());
        assertEquals("Note", definitions.get(1).getName());
        assertEquals(ModelDefinition.PERSISTED_MODEL, definitions.get(1).getBaseType());
    }

    @Test
    @DisplayName("模型级 ACL 与默认权限")
    void shouldLoadModelAcls() throws IOException {
        ModelDefinition account = loadFixture().get(0);

        assertEquals(Permission.DENY, account.getDefaultPermission());
        assertTrue(account.ownerRelationsIncludeAll());
        assertEquals(2, account.getAcls().size());
        assertEquals(Permission.DENY, account.getAcls().get(0).getPermission());
        assertEquals(List.of("find", "findById"), account.getAcls().get(1).getPropertyNames());
    }

    @Test
    @DisplayName("方法与关系名称取自 map key")
    void shouldFillNamesFromKeys() throws IOException {
        ModelDefinition account = loadFixture().get(0);

        MethodDefinition export = account.getMethods().get("export");
        assertEquals("export", export.getName());
        assertEquals(AccessType.READ, export.getAccessType());
        assertEquals(List.of("reporting"), export.getAccessScopes());
        assertSame(export, account.findMethod("download"));

        RelationDefinition holder = account.getRelations().get("holder");
        assertEquals("holder", holder.getName());
        assertEquals(RelationDefinition.Type.BELONGS_TO, holder.getType());
        assertEquals("holderId", holder.getForeignKeyOrDefault());
    }

    @Test
    @DisplayName("属性上的 ACL 转换为 AclDeclaration")
    void shouldConvertPropertyAcls() throws IOException {
        ModelDefinition account = loadFixture().get(0);

        List<AclDeclaration> balance = account.getPropertyAcls().get("balance");
        assertEquals(1, balance.size());
        assertEquals("$owner", balance.get(0).getPrincipalId());
        assertEquals(Permission.ALLOW, balance.get(0).getPermission());
    }

    @Test
    @DisplayName("缺少名称的模型被拒绝")
    void shouldRejectModelWithoutName() {
        InputStream in = new ByteArrayInputStream("baseType: User\n".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> ModelDefinitionLoader.load(in));
    }
}
