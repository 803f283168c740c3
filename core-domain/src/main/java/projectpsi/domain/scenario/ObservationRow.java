package projectpsi.domain.scenario;

import lombok.Builder;

/**
 * Un paso de tiempo de la simulación: concentraciones de afluente (1) y efluente (31) [mg/L].
 */
@Builder
public record ObservationRow(
        double bod1,
        double cod1,
        double snh1,
        double bod31,
        double cod31,
        double snh31
) {
}
