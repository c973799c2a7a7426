package org.truetranslation.sword.core.reference;

/**
 * Optional access to a native SWORD library for reading installed module
 * text. The installer never needs one; tools that compare installed content
 * against a reference rendering look one up through {@link ReferenceProviders}.
 */
public interface ReferenceProvider extends AutoCloseable {

    boolean isAvailable();

    /**
     * @param reference an OSIS-style reference such as {@code Gen.1.1}
     */
    String getVerse(String moduleId, String reference) throws ReferenceUnavailableException;

    String getModuleDescription(String moduleId) throws ReferenceUnavailableException;

    @Override
    void close();
}
