package tech.yump.settings.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.settings.crypto.EncryptionService;
import tech.yump.settings.document.SettingsContext;
import tech.yump.settings.document.SettingsJson;
import tech.yump.settings.prompt.ConsolePasswordPrompt;
import tech.yump.settings.prompt.PasswordPrompt;
import tech.yump.settings.storage.FileSystemTextFileStore;
import tech.yump.settings.storage.TextFileStore;

@Configuration
@Slf4j
public class SettingsConfiguration {

    private final LiteSettingsProperties properties;

    public SettingsConfiguration(LiteSettingsProperties properties) {
        this.properties = properties;
    }

    @Bean
    public EncryptionService encryptionService() {
        log.info("Configuring settings encryption with {} key derivation iterations.",
                properties.crypto().kdfIterations());
        return new EncryptionService(properties.crypto().kdfIterations());
    }

    @Bean
    public TextFileStore textFileStore() {
        return new FileSystemTextFileStore();
    }

    @Bean
    public PasswordPrompt passwordPrompt() {
        return new ConsolePasswordPrompt();
    }

    // Settings files get their own mapper; the application's ObjectMapper uses getter visibility.
    @Bean
    public SettingsContext settingsContext(EncryptionService encryptionService, TextFileStore textFileStore,
                                           PasswordPrompt passwordPrompt) {
        ObjectMapper settingsMapper = SettingsJson.newObjectMapper();
        return new SettingsContext(settingsMapper, encryptionService, textFileStore, passwordPrompt);
    }
}
