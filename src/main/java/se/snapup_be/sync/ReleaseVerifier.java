package se.snapup_be.sync;

/**
 * Asks the server to re-evaluate a hold whose local countdown ran out. Returns the
 * hold's current state, which may or may not be RELEASED.
 */
@FunctionalInterface
public interface ReleaseVerifier {

    ChangeEvent verifyRelease(Long orderId);
}
