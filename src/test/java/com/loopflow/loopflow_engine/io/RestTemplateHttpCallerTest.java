package com.loopflow.loopflow_engine.io;

import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RestTemplateHttpCallerTest {

    private final RestTemplate defaultTemplate = new RestTemplate();
    private final RestTemplateHttpCaller caller = new RestTemplateHttpCaller(defaultTemplate, new RestTemplateBuilder());

    @Test
    void timeoutsAreRoundedUpToWholeSecondsAndClamped() {
        assertThat(RestTemplateHttpCaller.timeoutKey(Duration.ofMillis(1500))).isEqualTo(Duration.ofSeconds(2));
        assertThat(RestTemplateHttpCaller.timeoutKey(Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(30));
        assertThat(RestTemplateHttpCaller.timeoutKey(Duration.ZERO)).isEqualTo(Duration.ofSeconds(1));
        assertThat(RestTemplateHttpCaller.timeoutKey(Duration.ofHours(5))).isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void timeoutsInTheSameSecondShareOneTemplate() {
        RestTemplate first = caller.templateFor(Duration.ofMillis(1200));
        RestTemplate second = caller.templateFor(Duration.ofMillis(1900));

        assertThat(first).isSameAs(second).isNotSameAs(defaultTemplate);
        assertThat(caller.templateFor(Duration.ofMillis(2100))).isNotSameAs(first);
        assertThat(caller.templateFor(null)).isSameAs(defaultTemplate);
    }

    @Test
    void unencodedUrlsAreEncoded() {
        assertThat(RestTemplateHttpCaller.toUri("https://example.com/a?q=1")).isEqualTo(URI.create("https://example.com/a?q=1"));
        assertThat(RestTemplateHttpCaller.toUri("https://example.com/search?q=a b").toString())
                .isEqualTo("https://example.com/search?q=a%20b");
    }
}
