package org.truetranslation.sword.core.reference;

/**
 * Stand-in used when no native library is registered.
 */
public class UnavailableReferenceProvider implements ReferenceProvider {
    static final String MESSAGE = "native SWORD library is not available in this build";

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String getVerse(String moduleId, String reference) throws ReferenceUnavailableException {
        throw new ReferenceUnavailableException(MESSAGE);
    }

    @Override
    public String getModuleDescription(String moduleId) throws ReferenceUnavailableException {
        throw new ReferenceUnavailableException(MESSAGE);
    }

    @Override
    public void close() {
    }
}
