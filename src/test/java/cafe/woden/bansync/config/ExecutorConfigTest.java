package cafe.woden.bansync.config;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class ExecutorConfigTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withUserConfiguration(PropsConfig.class, ExecutorConfig.class, ClockConfig.class);

  @Test
  void exposesFanoutExecutorWithNamedThreads() {
    runner.run(
        ctx -> {
          Object bean = ctx.getBean(ExecutorConfig.BAN_FANOUT_EXECUTOR);
          assertInstanceOf(ExecutorService.class, bean);
          String name =
              ((ExecutorService) bean)
                  .submit(() -> Thread.currentThread().getName())
                  .get(5, TimeUnit.SECONDS);
          assertTrue(name.startsWith("bansync-fanout-"), name);
        });
  }

  @Test
  void contextCloseShutsDownFanoutExecutor() {
    AtomicReference<ExecutorService> ref = new AtomicReference<>();

    runner.run(
        ctx -> ref.set(ctx.getBean(ExecutorConfig.BAN_FANOUT_EXECUTOR, ExecutorService.class)));

    assertTrue(ref.get().isShutdown());
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(BanSyncProperties.class)
  static class PropsConfig {}
}
