package tech.yump.settings.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties under the 'lite-settings' prefix.
 */
@ConfigurationProperties(prefix = "lite-settings")
@Validated
public record LiteSettingsProperties(

        @Valid
        @NotNull(message = "Crypto configuration (lite-settings.crypto) is required.")
        CryptoProperties crypto,

        @Valid
        @NotNull(message = "Shell configuration (lite-settings.shell) is required.")
        ShellProperties shell
) {

    // --- CryptoProperties ---
    @Validated
    public record CryptoProperties(
            @Min(value = 1000, message = "Key derivation iterations (lite-settings.crypto.kdf-iterations) must be at least 1000.")
            int kdfIterations
    ) {}

    // --- ShellProperties ---
    @Validated
    public record ShellProperties(
            boolean enabled,

            @NotBlank(message = "Settings directory (lite-settings.shell.directory) must be provided.")
            String directory,

            @NotBlank(message = "Settings file name (lite-settings.shell.file-name) must be provided.")
            String fileName
    ) {}
}
