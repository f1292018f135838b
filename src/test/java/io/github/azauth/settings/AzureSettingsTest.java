package io.github.azauth.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.azauth.UnsupportedCloudException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AzureSettings and the known-clouds table.
 */
class AzureSettingsTest {

    @Test
    void getCloud_withBuiltInName_returnsAuthority() throws Exception {
        AzureSettings settings = AzureSettings.builder().build();

        assertThat(settings.getCloud(AzureClouds.AZURE_PUBLIC).getAadAuthority())
                .isEqualTo("https://login.microsoftonline.com/");
        assertThat(settings.getCloud(AzureClouds.AZURE_CHINA).getAadAuthority())
                .isEqualTo("https://login.chinacloudapi.cn/");
        assertThat(settings.getCloud(AzureClouds.AZURE_US_GOVERNMENT).getAadAuthority())
                .isEqualTo("https://login.microsoftonline.us/");
    }

    @Test
    void getCloud_withAlias_resolvesCanonicalCloud() throws Exception {
        AzureSettings settings = AzureSettings.builder().build();

        assertThat(settings.getCloud("china").getName()).isEqualTo(AzureClouds.AZURE_CHINA);
        assertThat(settings.getCloud("AzurePublicCloud").getName()).isEqualTo(AzureClouds.AZURE_PUBLIC);
    }

    @Test
    void getCloud_withUnknownName_throwsUnsupportedCloud() {
        AzureSettings settings = AzureSettings.builder().build();

        assertThatThrownBy(() -> settings.getCloud("Narnia"))
                .isInstanceOf(UnsupportedCloudException.class)
                .hasMessageContaining("'Narnia'");
    }

    @Test
    void getCloud_withCustomCloud_findsCustomEntry() throws Exception {
        AzureCloudSettings custom = new AzureCloudSettings(
                "Private", "Private Cloud", "https://login.private.example/", Map.of());
        AzureSettings settings = AzureSettings.builder().customClouds(List.of(custom)).build();

        assertThat(settings.getCloud("Private")).isSameAs(custom);
    }

    @Test
    void getDefaultCloud_withoutCloud_returnsPublicCloud() {
        assertThat(AzureSettings.builder().build().getDefaultCloud()).isEqualTo(AzureClouds.AZURE_PUBLIC);
        assertThat(AzureSettings.builder().cloud(AzureClouds.AZURE_CHINA).build().getDefaultCloud())
                .isEqualTo(AzureClouds.AZURE_CHINA);
    }

    @Test
    void parseCustomClouds_withMissingAuthority_throwsIllegalArgument() {
        assertThatThrownBy(() -> AzureClouds.parseCustomClouds("[{\"name\":\"X\"}]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("aadAuthority");
    }

    @Test
    void toString_doesNotExposeUserIdentitySecret() {
        AzureSettings settings = AzureSettings.builder()
                .userIdentity(true, new TokenEndpointSettings("https://login/token", "c", "top-secret", false))
                .build();

        assertThat(settings.toString()).doesNotContain("top-secret");
    }
}
