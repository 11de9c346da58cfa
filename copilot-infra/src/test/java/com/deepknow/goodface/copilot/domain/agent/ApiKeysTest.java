package com.deepknow.goodface.copilot.domain.agent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeysTest {

    @Test
    void directKeyWinsOverEnvironment() {
        assertThat(ApiKeys.resolve("  sk-direct  ", "PATH")).isEqualTo("sk-direct");
    }

    @Test
    void missingKeyAndUnsetEnvResolveToNull() {
        assertThat(ApiKeys.resolve(null, "COPILOT_TEST_SURELY_UNSET_VAR")).isNull();
        assertThat(ApiKeys.resolve(" ", null)).isNull();
    }

    @Test
    void maskShowsOnlyLastFourCharacters() {
        assertThat(ApiKeys.mask("sk-ant-abcdef1234")).isEqualTo("****1234");
        assertThat(ApiKeys.mask("abc")).isEqualTo("****");
        assertThat(ApiKeys.mask(null)).isEqualTo("<none>");
    }
}
