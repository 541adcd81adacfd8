package cafe.woden.bansync.config;

import cafe.woden.bansync.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Spring owns creation and shutdown so nothing outlives the application context.
 */
@Configuration
public class ExecutorConfig {
  public static final String BAN_FANOUT_EXECUTOR = "banFanoutExecutor";

  @Bean(name = BAN_FANOUT_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService banFanoutExecutor(BanSyncProperties props) {
    return NamedThreads.newFixedThreadPool(props.fanoutParallelism(), "bansync-fanout");
  }
}
