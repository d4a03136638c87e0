/* (C)2026 */
package com.ammann.composemanager.properties;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ApiProperties")
class ApiPropertiesTest {

    @Test
    @DisplayName("should have correct base URL v1")
    void shouldHaveCorrectBaseUrlV1() {
        assertThat(ApiProperties.BASE_URL_V1).isEqualTo("/api/v1");
    }

    @Test
    @DisplayName("should construct full compose paths")
    void shouldConstructFullComposePaths() {
        String base = ApiProperties.BASE_URL_V1 + ApiProperties.Compose.BASE;

        assertThat(base).isEqualTo("/api/v1/compose");
        assertThat(base + ApiProperties.Compose.PROJECTS).isEqualTo("/api/v1/compose/projects");
        assertThat(base + ApiProperties.Compose.FILE_BY_PATH)
                .isEqualTo("/api/v1/compose/files/by-path");
        assertThat(base + ApiProperties.Compose.CONFLICTS).isEqualTo("/api/v1/compose/conflicts");
        assertThat(base + ApiProperties.Compose.REFRESH).isEqualTo("/api/v1/compose/refresh");
    }

    @Test
    @DisplayName("should have private constructors")
    void shouldHavePrivateConstructors() throws Exception {
        Constructor<ApiProperties> constructor = ApiProperties.class.getDeclaredConstructor();
        assertThat(java.lang.reflect.Modifier.isPrivate(constructor.getModifiers())).isTrue();

        Constructor<ApiProperties.Compose> composeConstructor =
                ApiProperties.Compose.class.getDeclaredConstructor();
        assertThat(java.lang.reflect.Modifier.isPrivate(composeConstructor.getModifiers()))
                .isTrue();
    }
}
