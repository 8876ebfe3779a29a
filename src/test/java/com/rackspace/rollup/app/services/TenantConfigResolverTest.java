package com.rackspace.rollup.app.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.rollup.app.config.AppProperties;
import com.rackspace.rollup.app.config.TenantProperties;
import com.rackspace.rollup.app.model.TenantConfigSnapshot;
import com.rackspace.rollup.app.model.TenantIsolationKey;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TenantConfigResolverTest {

  final TenantProperties tenantProperties = new TenantProperties();
  final AppProperties appProperties = new AppProperties();
  final TenantRegistry tenantRegistry = new TenantRegistry(100);

  TenantConfigResolver resolver;

  @BeforeEach
  void setUp() {
    tenantProperties
        .setDefaultDataSource("shared")
        .setDataSourceByAppId(Map.of("big", "dedicated"))
        .setRollupOnlyAppIds(Set.of("strict"))
        .setDataSources(Map.of(
            "shared", new TenantProperties.DataSource().setUrl("jdbc:h2:mem:shared"),
            "dedicated", new TenantProperties.DataSource().setUrl("jdbc:h2:mem:dedicated")
                .setMaximumPoolSize(20)
        ));
    resolver = new TenantConfigResolver(tenantProperties, appProperties, tenantRegistry,
        Caffeine.newBuilder().build());
  }

  @Test
  void selectsDataSourceByAppId() {
    tenantRegistry.register(TenantIsolationKey.of("t1"), "big");
    tenantRegistry.register(TenantIsolationKey.of("t2"), "small");

    final TenantConfigSnapshot dedicated = resolver.resolve(TenantIsolationKey.of("t1"));
    assertThat(dedicated.getDataSourceName()).isEqualTo("dedicated");
    assertThat(dedicated.getMaximumPoolSize()).isEqualTo(20);
    assertThat(dedicated.isRollupOnly()).isFalse();

    assertThat(resolver.resolve(TenantIsolationKey.of("t2")).getJdbcUrl())
        .isEqualTo("jdbc:h2:mem:shared");
  }

  @Test
  void rollupOnlyPerAppOrGlobal() {
    tenantRegistry.register(TenantIsolationKey.of("t1"), "strict");
    tenantRegistry.register(TenantIsolationKey.of("t2"), "small");

    assertThat(resolver.resolve(TenantIsolationKey.of("t1")).isRollupOnly()).isTrue();
    assertThat(resolver.resolve(TenantIsolationKey.of("t2")).isRollupOnly()).isFalse();
  }

  @Test
  void snapshotIsStable() {
    tenantRegistry.register(TenantIsolationKey.of("t1"), "small");
    final TenantConfigSnapshot first = resolver.resolve(TenantIsolationKey.of("t1"));

    appProperties.setRollupOnly(true);

    assertThat(resolver.resolve(TenantIsolationKey.of("t1"))).isSameAs(first);
  }

  @Test
  void unknownTenant() {
    assertThatThrownBy(() -> resolver.resolve(TenantIsolationKey.of("nobody")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void unknownDataSource() {
    tenantProperties.setDefaultDataSource("missing");
    tenantRegistry.register(TenantIsolationKey.of("t1"), "small");

    assertThatThrownBy(() -> resolver.resolve(TenantIsolationKey.of("t1")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("missing");
  }
}
