package sandboxstudio.playback.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import sandboxstudio.playback.domain.BaselineEntity;

public record BaselineCountyRequest(
        @NotBlank(message = "FIPS code is required")
        @Pattern(regexp = "^\\s*\\d{1,5}\\s*$", message = "FIPS code must be 1 to 5 digits")
        String fips,

        @Size(max = 2, message = "State code must be at most 2 characters")
        String stateCode,

        @Size(max = 100, message = "County name must be at most 100 characters")
        String countyName,

        @PositiveOrZero(message = "Expected total votes must not be negative")
        long expectedTotalVotes,

        @DecimalMin(value = "0.0", message = "Dem share must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Dem share must be between 0 and 1")
        Double demShare,

        @DecimalMin(value = "0.0", message = "GOP share must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "GOP share must be between 0 and 1")
        Double gopShare
) {
    public BaselineEntity toEntity() {
        return new BaselineEntity(
                fips,
                null,
                stateCode,
                countyName,
                expectedTotalVotes,
                demShare == null ? 0 : demShare,
                gopShare == null ? 0 : gopShare
        );
    }
}
