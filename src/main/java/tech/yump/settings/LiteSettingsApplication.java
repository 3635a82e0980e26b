package tech.yump.settings;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.settings.config.LiteSettingsProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(LiteSettingsProperties.class)
public class LiteSettingsApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteSettingsApplication.class, args);
    log.info(">>> LiteSettings Application Finished <<<");
  }
}
