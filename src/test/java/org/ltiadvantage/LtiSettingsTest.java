package org.ltiadvantage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;

class LtiSettingsTest {

	private static Properties properties(String... pairs) {
		Properties p = new Properties();
		for (int i = 0; i < pairs.length; i += 2) p.setProperty(pairs[i], pairs[i + 1]);
		return p;
	}

	@Test
	void defaultsApplyWhenUnset() {
		LtiSettings settings = new LtiSettings(new Properties(), Collections.<String, String>emptyMap());

		assertThat(settings.datastore()).isEqualTo("memory");
		assertThat(settings.httpTimeout()).isEqualTo(Duration.ofSeconds(15));
		assertThat(settings.launchLifetime()).isEqualTo(Duration.ofMinutes(90));
		assertThat(settings.nonceLifetime()).isEqualTo(Duration.ofMinutes(90));
		assertThat(settings.get(LtiSettings.KEY_PEM)).isNull();
	}

	@Test
	void environmentOverridesPropertiesFile() {
		LtiSettings settings = new LtiSettings(properties(LtiSettings.DATASTORE, "memory", LtiSettings.HTTP_TIMEOUT_SECONDS, "15"),
				Map.of("LTI_DATASTORE", "jdbc", "LTI_HTTP_TIMEOUT_SECONDS", "30"));

		assertThat(settings.datastore()).isEqualTo("jdbc");
		assertThat(settings.httpTimeout()).isEqualTo(Duration.ofSeconds(30));
	}

	@Test
	void blankValuesCountAsUnset() {
		LtiSettings settings = new LtiSettings(properties(LtiSettings.JDBC_URL, "  "), Collections.<String, String>emptyMap());

		assertThat(settings.get(LtiSettings.JDBC_URL)).isNull();
		assertThat(settings.get(LtiSettings.JDBC_URL, "jdbc:sqlite:lti.db")).isEqualTo("jdbc:sqlite:lti.db");
	}

	@Test
	void nonNumericLifetimeIsConfigurationError() {
		LtiSettings settings = new LtiSettings(properties(LtiSettings.LAUNCH_LIFETIME_MINUTES, "ninety"), Collections.<String, String>emptyMap());

		assertThatThrownBy(settings::launchLifetime).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void loadsBundledProperties() throws Exception {
		LtiSettings settings = LtiSettings.load();

		assertThat(settings.get(LtiSettings.NONCE_LIFETIME_MINUTES)).isNotNull();
	}
}
