package com.example.offlinecache.partition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.offlinecache.core.ConfigException;
import com.example.offlinecache.core.NetRequest;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PartitionRegistryTest {

    private final PartitionRegistry registry = new PartitionRegistry();

    @Test
    void rejectsPartitionWithoutRules() {
        Partition partition = new Partition("empty", List.of(), StrategyType.CACHE_FIRST, 0, 5, null, null);

        assertThatThrownBy(() -> registry.register(partition))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("no match rules");
    }

    @Test
    void rejectsNonPositiveMaxEntries() {
        assertThatThrownBy(() -> registry.register(Partition.of("zero", StrategyType.CACHE_FIRST, 0, 0, "/x")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("maxEntries");
    }

    @Test
    void rejectsDuplicateAndUnsafeNames() {
        registry.register(Partition.of("api", StrategyType.NETWORK_FIRST, 0, 5, "/api/"));

        assertThatThrownBy(() -> registry.register(Partition.of("api", StrategyType.CACHE_FIRST, 0, 5, "/other/")))
            .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> registry.register(Partition.of("../etc", StrategyType.CACHE_FIRST, 0, 5, "/x")))
            .isInstanceOf(ConfigException.class);
    }

    @Test
    void firstDeclaredMatchWins() {
        registry.register(Partition.of("static", StrategyType.CACHE_FIRST, 0, 200, "\\.(?:png|css)$"));
        registry.register(Partition.of("images", StrategyType.CACHE_FIRST, 0, 100, "/images/"));

        assertThat(registry.resolve(NetRequest.get("http://app.test/images/car.png")))
            .hasValueSatisfying(p -> assertThat(p.getName()).isEqualTo("static"));
        assertThat(registry.resolve(NetRequest.get("http://app.test/images/car")))
            .hasValueSatisfying(p -> assertThat(p.getName()).isEqualTo("images"));
    }

    @Test
    void matchesPathIgnoringQueryAndAbsoluteUrlForOtherHosts() {
        registry.register(Partition.of("static", StrategyType.CACHE_FIRST, 0, 200, "\\.css$"));
        registry.register(Partition.of("fonts", StrategyType.STALE_WHILE_REVALIDATE, 0, 30, "fonts\\.googleapis\\.com"));

        assertThat(registry.resolve(NetRequest.get("http://app.test/site.css?v=3"))).isPresent();
        assertThat(registry.resolve(NetRequest.get("https://fonts.googleapis.com/css2?family=Inter")))
            .hasValueSatisfying(p -> assertThat(p.getName()).isEqualTo("fonts"));
    }

    @Test
    void unmatchedRequestsAndMutatingMethodsResolveToNothing() {
        registry.register(Partition.of("api", StrategyType.NETWORK_FIRST, 0, 30, "/api/"));

        assertThat(registry.resolve(NetRequest.get("http://app.test/about"))).isEmpty();
        assertThat(registry.resolve(new NetRequest("POST", "http://app.test/api/contact", Map.of(), "{}"))).isEmpty();
    }

    @Test
    void parsesConfiguredStrategyNames() {
        assertThat(StrategyType.parse("stale-while-revalidate")).isEqualTo(StrategyType.STALE_WHILE_REVALIDATE);
        assertThat(StrategyType.parse("NETWORK_FIRST")).isEqualTo(StrategyType.NETWORK_FIRST);
        assertThatThrownBy(() -> StrategyType.parse("cache-only")).isInstanceOf(ConfigException.class);
    }
}
