package ch.animalgame.animalgameengine.domain;

import ch.animalgame.animalgameengine.domain.enums.IllegalReason;
import ch.animalgame.animalgameengine.domain.enums.MoveKind;

/**
 * Outcome of validating a move request.
 *
 * <p>Exactly one of {@code kind} and {@code reason} is set.
 *
 * @param kind    kind of the legal move, {@code null} when rejected
 * @param capture {@code true} if the legal move lands on an opposing piece
 * @param reason  rejection reason, {@code null} when legal
 */
public record MoveValidation(MoveKind kind, boolean capture, IllegalReason reason) {

    public static MoveValidation legal(MoveKind kind, boolean capture) {
        return new MoveValidation(kind, capture, null);
    }

    public static MoveValidation illegal(IllegalReason reason) {
        return new MoveValidation(null, false, reason);
    }

    public boolean isLegal() {
        return reason == null;
    }
}
