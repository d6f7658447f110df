package com.eden.gateway.discovery;

import com.eden.gateway.exception.ServiceUnavailableException;
import com.eden.gateway.router.Route;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.eden.gateway.discovery.ServiceRegistryTest.instance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for health-aware round-robin selection
 */
class RoundRobinLoadBalancerTest {

    private ServiceRegistry registry;
    private RoundRobinLoadBalancer loadBalancer;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        loadBalancer = new RoundRobinLoadBalancer(registry);

        registry.registerInstance(instance("vault-1", "vault", HealthStatus.HEALTHY));
        registry.registerInstance(instance("vault-2", "vault", HealthStatus.HEALTHY));
        registry.registerInstance(instance("vault-3", "vault", HealthStatus.UNHEALTHY));
    }

    @Test
    void selectInstance_ShouldNeverPickUnhealthyInstance() {
        for (int i = 0; i < 50; i++) {
            Optional<ServiceInstance> selected = loadBalancer.selectInstance("vault");

            assertThat(selected).isPresent();
            assertThat(selected.get().getHealth()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(selected.get().getId()).isNotEqualTo("vault-3");
        }
    }

    @Test
    void selectInstance_ShouldDistributeAcrossHealthyInstances() {
        Map<String, Integer> selections = new HashMap<>();

        for (int i = 0; i < 10; i++) {
            loadBalancer.selectInstance("vault").ifPresent(inst -> selections.merge(inst.getId(), 1, Integer::sum));
        }

        assertThat(selections).containsOnlyKeys("vault-1", "vault-2");
        assertThat(selections.get("vault-1")).isEqualTo(5);
        assertThat(selections.get("vault-2")).isEqualTo(5);
    }

    @Test
    void selectInstance_WithOnlyUnhealthyInstances_ShouldReturnEmpty() {
        registry.updateInstanceHealth("vault-1", HealthStatus.UNHEALTHY);
        registry.updateInstanceHealth("vault-2", HealthStatus.UNKNOWN);

        assertThat(loadBalancer.selectInstance("vault")).isEmpty();
    }

    @Test
    void selectInstance_ShouldFollowHealthChanges() {
        registry.updateInstanceHealth("vault-1", HealthStatus.UNHEALTHY);
        registry.updateInstanceHealth("vault-3", HealthStatus.HEALTHY);

        for (int i = 0; i < 10; i++) {
            assertThat(loadBalancer.selectInstance("vault"))
                    .map(ServiceInstance::getId)
                    .hasValueSatisfying(id -> assertThat(id).isIn("vault-2", "vault-3"));
        }
    }

    @Test
    void resolveTarget_WithoutRegisteredInstances_ShouldUseStaticTarget() {
        Route route = Route.builder()
                .serviceName("task")
                .pathPrefix("/api/v1/task")
                .target("http://task:8080")
                .build();

        assertThat(loadBalancer.resolveTarget(route)).isEqualTo("http://task:8080");
    }

    @Test
    void resolveTarget_WithHealthyInstance_ShouldUseInstanceAddress() {
        Route route = Route.builder()
                .serviceName("vault")
                .pathPrefix("/api/v1/vault")
                .target("http://vault:8080")
                .build();

        assertThat(loadBalancer.resolveTarget(route)).isEqualTo("http://10.0.0.1:8080");
    }

    @Test
    void resolveTarget_WithNoHealthyInstance_ShouldNameTheService() {
        registry.updateInstanceHealth("vault-1", HealthStatus.UNHEALTHY);
        registry.updateInstanceHealth("vault-2", HealthStatus.UNHEALTHY);
        Route route = Route.builder()
                .serviceName("vault")
                .pathPrefix("/api/v1/vault")
                .target("http://vault:8080")
                .build();

        ServiceUnavailableException ex = assertThrows(ServiceUnavailableException.class,
                () -> loadBalancer.resolveTarget(route));

        assertThat(ex.getService()).isEqualTo("vault");
        assertThat(ex.getStatus().value()).isEqualTo(503);
    }
}
