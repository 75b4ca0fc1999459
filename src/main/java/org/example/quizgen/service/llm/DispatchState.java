package org.example.quizgen.service.llm;

/**
 * Per-candidate states of a dispatch run. Candidate selection happens before the first
 * CALLING state; running out of candidates after the last NEXT_CANDIDATE ends the run.
 */
enum DispatchState {
    CALLING,
    RETRYING,
    COOLING_DOWN,
    NEXT_CANDIDATE
}
