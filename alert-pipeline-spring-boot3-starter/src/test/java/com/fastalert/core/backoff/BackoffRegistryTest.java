package com.fastalert.core.backoff;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.spi.BackoffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRegistryTest {

    private AlertPipelineProperties props;

    @BeforeEach
    void setUp() {
        props = new AlertPipelineProperties();
        props.getBackoff().setBase(Duration.ofMillis(200));
        props.getBackoff().setMin(Duration.ofMillis(100));
        props.getBackoff().setMax(Duration.ofSeconds(5));
        props.getBackoff().setJitterRatio(0);
    }

    private void useStrategy(String channel, String strategy) {
        AlertPipelineProperties.Channel c = new AlertPipelineProperties.Channel();
        c.setBackoff(strategy);
        props.getChannels().put(channel, c);
    }

    @Test
    void exponentialDoublesAndCaps() {
        BackoffRegistry reg = new BackoffRegistry(props);

        assertThat(reg.delayMillis("mail", 1, 1.0)).isEqualTo(200);
        assertThat(reg.delayMillis("mail", 2, 1.0)).isEqualTo(400);
        assertThat(reg.delayMillis("mail", 3, 1.0)).isEqualTo(800);
        assertThat(reg.delayMillis("mail", 10, 1.0)).isEqualTo(5000);
    }

    @Test
    void decisionFactorStretchesDelay() {
        BackoffRegistry reg = new BackoffRegistry(props);

        assertThat(reg.delayMillis("mail", 1, 1.5)).isEqualTo(300);
        assertThat(reg.delayMillis("mail", 1, 0)).isEqualTo(200);
    }

    @Test
    void jitterStaysWithinBounds() {
        props.getBackoff().setJitterRatio(0.2);
        BackoffRegistry reg = new BackoffRegistry(props);

        for (int i = 0; i < 100; i++) {
            assertThat(reg.delayMillis("mail", 2, 1.0)).isBetween(320L, 480L);
        }
    }

    @Test
    void channelCanSelectStrategy() {
        useStrategy("sms", "fixed");
        BackoffRegistry reg = new BackoffRegistry(props);

        assertThat(reg.delayMillis("sms", 1, 1.0)).isEqualTo(200);
        assertThat(reg.delayMillis("sms", 4, 1.0)).isEqualTo(200);
    }

    @Test
    void spiPoliciesResolveByName() {
        BackoffPolicy linear = new BackoffPolicy() {
            @Override
            public String name() {
                return "Linear";
            }

            @Override
            public long delayMillis(int attempt, String channel, AlertPipelineProperties p) {
                return attempt * 50L;
            }
        };
        useStrategy("hook", "spi:linear");
        BackoffRegistry reg = new BackoffRegistry(props, List.of(linear));

        assertThat(reg.delayMillis("hook", 3, 1.0)).isEqualTo(150);
        assertThat(reg.names()).contains("linear", "fixed", "exponential");
        assertThat(reg.resolve("no-such-policy")).isInstanceOf(ExponentialJitterBackoffPolicy.class);
    }

    @Test
    void invalidBoundsAreRejected() {
        props.getBackoff().setMax(Duration.ofMillis(50));
        BackoffRegistry reg = new BackoffRegistry(props);

        assertThatThrownBy(reg::afterPropertiesSet).isInstanceOf(IllegalArgumentException.class);
    }
}
