package io.kwinctl.ipc;

import java.nio.file.Path;

/**
 * Remote scripting host the generated script is shipped to.
 *
 * <p>Two channels are involved: a control channel for load, run, stop and unload, and a private receiving
 * channel whose bus address the running script calls back into. Implementations open the receiving channel
 * lazily, so paths that only unload a script never create it.</p>
 */
public interface ScriptHost extends AutoCloseable {
    /**
     * Bus address of the receiving channel, embedded into the script so callbacks reach this process.
     */
    String callbackAddress();

    /**
     * Loads the script file under {@code name}. The file must stay readable until this call returns.
     *
     * @return opaque script instance id
     */
    int loadScript(Path script, String name);

    void runScript(int scriptId);

    void stopScript(int scriptId);

    void unloadScript(String name);

    /**
     * Starts delivering inbound callbacks to {@code handler} until the returned registration is closed.
     */
    Registration receiveCallbacks(CallbackHandler handler);

    @Override
    void close();

    /**
     * Receives one callback: the called member name is the tag, the first string argument the payload.
     */
    @FunctionalInterface
    interface CallbackHandler {
        void onCallback(String tag, String payload);
    }

    interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
