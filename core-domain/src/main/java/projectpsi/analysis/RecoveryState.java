package projectpsi.analysis;

/**
 * Estados de la máquina de recuperación. "LUT Exceedance" y "Max Limit Failure"
 * se agrupan en {@link #NON_COMPLIANT}.
 */
public enum RecoveryState {
    COMPLIANT,
    NON_COMPLIANT
}
