package cafe.woden.bansync;

import cafe.woden.bansync.banlog.BanLogService;
import cafe.woden.bansync.config.BanSyncProperties;
import cafe.woden.bansync.network.NetworkRegistryService;
import cafe.woden.bansync.store.FileDocumentStore;
import cafe.woden.bansync.store.api.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "BanSync",
    sharedModules = {"config", "util"})
@EnableConfigurationProperties(BanSyncProperties.class)
public class BanSyncApp {
  private static final Logger log = LoggerFactory.getLogger(BanSyncApp.class);

  public static void main(String[] args) {
    SpringApplication.run(BanSyncApp.class, args);
  }

  @Bean
  public ApplicationRunner initializeDocuments(
      DocumentStore store, NetworkRegistryService registry, BanLogService banLog) {
    return args -> {
      // Both documents must exist before the first command; an absent one is an error afterwards.
      store.initializeIfAbsent(registry.documentName(), registry.emptyDocument());
      store.initializeIfAbsent(banLog.documentName(), banLog.emptyDocument());
      if (store instanceof FileDocumentStore files) {
        log.info("[bansync] Ready; data directory {}", files.dataDir());
      } else {
        log.info("[bansync] Ready");
      }
    };
  }
}
