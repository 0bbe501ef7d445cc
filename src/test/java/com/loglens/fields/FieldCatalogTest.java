package com.loglens.fields;

import com.loglens.query.UnresolvedFieldException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FieldCatalog Tests")
class FieldCatalogTest {

    private static DiscoveredField discovered(String name, FieldType type) {
        return new DiscoveredField(name, type, 1, List.of());
    }

    @Test
    void shouldListBuiltInFieldsInOrder() {
        FieldCatalog catalog = FieldCatalog.builtIn();

        assertThat(catalog.getVersion()).isZero();
        assertThat(catalog.allFields()).extracting(FieldDefinition::getName).containsExactly(
            "timestamp", "hostname", "app_name", "severity", "facility", "priority",
            "message", "raw", "index_name", "protocol", "source_ip", "source_port");
        assertThat(catalog.getDiscoveredFields()).isEmpty();
    }

    @Test
    @DisplayName("Canonical names and aliases should resolve case-insensitively")
    void shouldResolveCanonicalNamesAndAliases() {
        FieldCatalog catalog = FieldCatalog.builtIn();

        assertThat(catalog.resolve("hostname").getName()).isEqualTo("hostname");
        assertThat(catalog.resolve("HOST").getName()).isEqualTo("hostname");
        assertThat(catalog.resolve("source").getName()).isEqualTo("hostname");
        assertThat(catalog.resolve("sourcetype").getName()).isEqualTo("app_name");
        assertThat(catalog.resolve("_time").getName()).isEqualTo("timestamp");
        assertThat(catalog.resolve("src_ip").getType()).isEqualTo(FieldType.IP);
        assertThat(catalog.resolve("level").getType()).isEqualTo(FieldType.INTEGER);
    }

    @Test
    void shouldFailOnUnknownField() {
        assertThat(FieldCatalog.builtIn().find("nosuchfield")).isEmpty();
        assertThat(FieldCatalog.builtIn().find("")).isEmpty();
        assertThatThrownBy(() -> FieldCatalog.builtIn().resolve("nosuchfield"))
            .isInstanceOf(UnresolvedFieldException.class)
            .hasMessageContaining("nosuchfield");
    }

    @Test
    void shouldReadDiscoveredFieldsFromStructuredData() {
        FieldCatalog catalog = FieldCatalog.withDiscovered(4L, List.of(
            discovered("user", FieldType.STRING),
            discovered("bytes", FieldType.INTEGER)));

        FieldDefinition user = catalog.resolve("user");
        FieldDefinition bytes = catalog.resolve("BYTES");

        assertThat(catalog.getVersion()).isEqualTo(4L);
        assertThat(user.getOrigin()).isEqualTo(FieldOrigin.DISCOVERED);
        assertThat(user.getStorageExpression()).isEqualTo("JSONExtractString(structured_data, 'user')");
        assertThat(bytes.getStorageExpression()).isEqualTo("JSONExtractFloat(structured_data, 'bytes')");
        assertThat(catalog.allFields()).extracting(FieldDefinition::getName).endsWith("user", "bytes");
    }

    @Test
    @DisplayName("Discovered keys that collide with core names or aliases should be dropped")
    void shouldDropCollidingDiscoveredKeys() {
        FieldCatalog catalog = FieldCatalog.withDiscovered(1L, List.of(
            discovered("host", FieldType.STRING),
            discovered("Message", FieldType.STRING),
            discovered("user", FieldType.STRING),
            discovered("user", FieldType.NUMBER)));

        assertThat(catalog.getDiscoveredFields()).extracting(FieldDefinition::getName).containsExactly("user");
        assertThat(catalog.resolve("host").getOrigin()).isEqualTo(FieldOrigin.CORE);
        assertThat(catalog.resolve("user").getType()).isEqualTo(FieldType.STRING);
    }

    @Test
    void shouldSkipUnsafeKeys() {
        FieldCatalog catalog = FieldCatalog.withDiscovered(1L, List.of(
            discovered("bad'key", FieldType.STRING),
            discovered("with space", FieldType.STRING),
            discovered("http.status", FieldType.INTEGER)));

        assertThat(catalog.getDiscoveredFields()).extracting(FieldDefinition::getName).containsExactly("http.status");
    }

    @Test
    void shouldPreferExactDiscoveredMatch() {
        FieldCatalog catalog = FieldCatalog.withDiscovered(1L, List.of(
            discovered("userId", FieldType.STRING),
            discovered("userid", FieldType.NUMBER)));

        assertThat(catalog.resolve("userid").getType()).isEqualTo(FieldType.NUMBER);
        assertThat(catalog.resolve("userId").getType()).isEqualTo(FieldType.STRING);
        assertThat(catalog.resolve("USERID").getName()).isEqualTo("userId");
    }
}
