package io.nebula.identity.user;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Password hashing and verification using Argon2id.
 *
 * Parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 *
 * Hashes are stored in PHC format, so the parameters travel with each hash and
 * {@link #needsRehash(String)} can detect hashes made with older settings.
 */
@ApplicationScoped
public class PasswordService {

    private static final int MEMORY_COST = 65536;  // 64 MiB in KiB
    private static final int ITERATIONS = 3;       // Time cost
    private static final int PARALLELISM = 4;      // Parallel threads
    private static final int HASH_LENGTH = 32;     // Output length in bytes
    private static final int SALT_LENGTH = 16;     // Salt length in bytes

    // Password policy
    static final int MIN_PASSWORD_LENGTH = 8;
    static final int MAX_PASSWORD_LENGTH = 128;

    private final Argon2 argon2;

    public PasswordService() {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * Hash a password using Argon2id.
     *
     * @param plainPassword The plain text password
     * @return The hashed password in PHC format (e.g., $argon2id$v=19$m=65536,t=3,p=4$...)
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, plainPassword.toCharArray());
    }

    /**
     * Verify a password against a hash. Never throws: a null input or a
     * malformed hash simply does not match.
     *
     * @param plainPassword The plain text password to verify
     * @param passwordHash  The hash to verify against (PHC format)
     * @return true if password matches the hash
     */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }

        try {
            return argon2.verify(passwordHash, plainPassword.toCharArray());
        } catch (Exception e) {
            // Invalid hash format or verification error
            return false;
        }
    }

    /**
     * Check if a password hash was produced with parameters other than the current ones.
     *
     * @param passwordHash The hash to check
     * @return true if the hash should be regenerated with current parameters
     */
    public boolean needsRehash(String passwordHash) {
        if (passwordHash == null || passwordHash.isEmpty()) {
            return true;
        }

        // PHC format: $argon2id$v=19$m=65536,t=3,p=4$<salt>$<hash>
        if (!passwordHash.startsWith("$argon2id$")) {
            return true;
        }

        String[] parts = passwordHash.split("\\$");
        if (parts.length < 4) {
            return true;
        }

        String params = parts[3];
        boolean hasCorrectMemory = params.contains("m=" + MEMORY_COST);
        boolean hasCorrectIterations = params.contains("t=" + ITERATIONS);
        boolean hasCorrectParallelism = params.contains("p=" + PARALLELISM);

        return !(hasCorrectMemory && hasCorrectIterations && hasCorrectParallelism);
    }

    /**
     * Validate the password policy: between 8 and 128 characters.
     *
     * @throws IllegalArgumentException if password doesn't meet requirements
     */
    public void validatePasswordPolicy(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException(
                "Password must be at least " + MIN_PASSWORD_LENGTH + " characters long"
            );
        }

        if (password.length() > MAX_PASSWORD_LENGTH) {
            throw new IllegalArgumentException(
                "Password must be at most " + MAX_PASSWORD_LENGTH + " characters long"
            );
        }
    }

    /**
     * Validate and hash a password.
     *
     * @throws IllegalArgumentException if password doesn't meet the policy
     */
    public String validateAndHashPassword(String plainPassword) {
        validatePasswordPolicy(plainPassword);
        return hashPassword(plainPassword);
    }
}
