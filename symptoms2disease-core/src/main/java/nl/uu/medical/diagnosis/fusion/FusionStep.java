package nl.uu.medical.diagnosis.fusion;

/**
 * One named rule of the fusion chain. Steps never mutate their input; they return the next
 * state and explain themselves through the trace.
 */
public interface FusionStep {

    String name();

    FusionState apply(FusionInput input, FusionState state, ReasoningTrace trace);
}
