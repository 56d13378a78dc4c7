package cafe.woden.chatlayout.architecture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import cafe.woden.chatlayout.ChatLayoutApp;
import cafe.woden.chatlayout.layout.LayoutEngine;
import cafe.woden.chatlayout.layout.api.LayoutPolicy;
import cafe.woden.chatlayout.layout.api.MessageSource;
import cafe.woden.chatlayout.memory.MemoryPressureMonitor;
import cafe.woden.chatlayout.reconcile.ThreadUpdateCoordinator;
import cafe.woden.chatlayout.reconcile.api.ThreadPresenter;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;
import org.springframework.modulith.core.NamedInterface;

class SpringModulithModulesTest {

  @Test
  void applicationModulesCanBeDiscovered() {
    assertThatCode(() -> ApplicationModules.of(ChatLayoutApp.class)).doesNotThrowAnyException();
  }

  @Test
  void typesResolveToExpectedModules() {
    ApplicationModules modules = ApplicationModules.of(ChatLayoutApp.class);

    ApplicationModule layout = moduleFor(modules, LayoutEngine.class);
    assertThat(layout.getBasePackage().getName()).isEqualTo("cafe.woden.chatlayout.layout");
    assertNamedInterfaceContains(layout, "api", MessageSource.class, LayoutPolicy.class);

    ApplicationModule reconcile = moduleFor(modules, ThreadUpdateCoordinator.class);
    assertThat(reconcile).isNotEqualTo(layout);
    assertThat(reconcile.getBasePackage().getName()).isEqualTo("cafe.woden.chatlayout.reconcile");
    assertNamedInterfaceContains(reconcile, "api", ThreadPresenter.class);

    ApplicationModule memory = moduleFor(modules, MemoryPressureMonitor.class);
    assertThat(memory.getBasePackage().getName()).isEqualTo("cafe.woden.chatlayout.memory");
  }

  @Test
  void moduleVerificationPassesWithCurrentBoundaries() {
    ApplicationModules.of(ChatLayoutApp.class).verify();
  }

  private static ApplicationModule moduleFor(ApplicationModules modules, Class<?> type) {
    return modules
        .getModuleByType(type)
        .orElseThrow(() -> new AssertionError("No module discovered for type " + type.getName()));
  }

  private static void assertNamedInterfaceContains(
      ApplicationModule module, String name, Class<?>... types) {
    NamedInterface named =
        module
            .getNamedInterfaces()
            .getByName(name)
            .orElseThrow(() -> new AssertionError("No named interface '" + name + "'"));
    for (Class<?> type : types) {
      assertThat(named.contains(type)).as("%s exposes %s", name, type.getSimpleName()).isTrue();
    }
  }
}
