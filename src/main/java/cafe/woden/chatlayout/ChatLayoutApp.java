package cafe.woden.chatlayout;

import cafe.woden.chatlayout.config.ChatLayoutProperties;
import cafe.woden.chatlayout.layout.LayoutEngine;
import cafe.woden.chatlayout.memory.MemoryPressureMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "ChatLayout",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties({ChatLayoutProperties.class})
public class ChatLayoutApp {
  private static final Logger log = LoggerFactory.getLogger(ChatLayoutApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(ChatLayoutApp.class).headless(true).run(args);
  }

  @Bean
  public ApplicationRunner run(
      LayoutEngine engine, MemoryPressureMonitor memoryMonitor, ChatLayoutProperties props) {
    return args ->
        log.info(
            "[chatlayout] layout engine ready (cache {} entries, memory watch {})",
            engine.cache().maxSize(),
            memoryMonitor.isRunning() && props.memory().enabled() ? "on" : "off");
  }
}
