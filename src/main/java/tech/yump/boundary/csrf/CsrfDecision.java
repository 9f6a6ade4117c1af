package tech.yump.boundary.csrf;

import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * Outcome of {@link CsrfPolicyEngine#evaluate}.
 *
 * @param requestClass null when protection is disabled.
 * @param failure      the reason for rejection; null when allowed.
 * @param instructions token delivery for the response; null when nothing is to be delivered.
 */
public record CsrfDecision(
        boolean allowed,
        @Nullable RequestClass requestClass,
        @Nullable CsrfFailure failure,
        @Nullable CsrfResponseInstructions instructions
) {

    static CsrfDecision allow(@Nullable RequestClass requestClass, @Nullable CsrfResponseInstructions instructions) {
        return new CsrfDecision(true, requestClass, null, instructions);
    }

    static CsrfDecision reject(RequestClass requestClass, CsrfFailure failure) {
        return new CsrfDecision(false, requestClass, failure, null);
    }

    public Optional<CsrfResponseInstructions> responseInstructions() {
        return Optional.ofNullable(instructions);
    }
}
