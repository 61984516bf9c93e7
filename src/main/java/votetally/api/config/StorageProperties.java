package votetally.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;
import votetally.api.domain.StorageKind;

@Validated
@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
        @NotNull @DefaultValue("relational") StorageKind backend,
        @Valid @DefaultValue Queue queue,
        @Valid @DefaultValue Relational relational
) {

    public record Queue(
            @NotBlank @DefaultValue("votes") String name,
            @NotBlank @DefaultValue("votes:tally") String tallyKey,
            @Positive @DefaultValue("500") int drainBatchSize
    ) {
        public String deadLetterKey() {
            return name + ":dead";
        }
    }

    public record Relational(
            @Pattern(regexp = "[a-zA-Z_][a-zA-Z0-9_]*", message = "Table name must be a plain SQL identifier")
            @DefaultValue("votes") String table
    ) {
    }
}
