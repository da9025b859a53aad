package com.compara.provider;

/**
 * Receives a provider's output as it streams.
 */
public interface FragmentSink {

    /**
     * A piece of generated text, in arrival order. May be whitespace only.
     */
    void onFragment(String fragment);

    /**
     * The provider signalled it is still working without producing text.
     */
    default void onKeepalive() {
    }
}
