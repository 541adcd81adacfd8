package cafe.woden.bansync.sync;

import static org.assertj.core.api.Assertions.assertThat;

import cafe.woden.bansync.network.api.Network;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FanoutResolverTest {

  private final FanoutResolver resolver = new FanoutResolver();

  @Test
  void targetsAreUnionOfSharedNetworksMinusOrigin() {
    Map<String, Network> registry = new LinkedHashMap<>();
    registry.put("a", network("a", "1", "2", "3"));
    registry.put("b", network("b", "3", "1", "4"));
    registry.put("c", network("c", "5", "6"));

    FanoutTargets targets = resolver.targetsFor("1", registry);

    assertThat(targets.networkNames()).containsExactly("a", "b");
    assertThat(targets.targetServerIds()).containsExactly("2", "3", "4");
    assertThat(targets.hasNetworks()).isTrue();
  }

  @Test
  void soleMemberHasNetworksButNoTargets() {
    FanoutTargets targets = resolver.targetsFor("1", Map.of("solo", network("solo", "1")));

    assertThat(targets.networkNames()).containsExactly("solo");
    assertThat(targets.targetServerIds()).isEmpty();
  }

  @Test
  void originOutsideEveryNetworkResolvesToNothing() {
    FanoutTargets targets = resolver.targetsFor("9", Map.of("a", network("a", "1", "2")));

    assertThat(targets.hasNetworks()).isFalse();
    assertThat(targets.targetServerIds()).isEmpty();
    assertThat(resolver.targetsFor(" ", Map.of("a", network("a", "1"))).hasNetworks()).isFalse();
  }

  private static Network network(String name, String... members) {
    return new Network(name, members[0], List.of(members), Instant.EPOCH);
  }
}
