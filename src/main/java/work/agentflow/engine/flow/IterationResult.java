package work.agentflow.engine.flow;

import work.agentflow.engine.state.IterationRecord;

/**
 * Final record of one loop iteration plus how its body stopped.
 */
record IterationResult(IterationRecord record, SequenceOutcome outcome) {}
