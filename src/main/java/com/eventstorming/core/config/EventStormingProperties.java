package com.eventstorming.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for workshop storage and output.
 *
 * <pre>
 * eventstorming:
 *   storage:
 *     type: file          # file | memory
 *     directory: ${user.home}/.eventstorming_workshops
 *   output:
 *     character-limit: 25000
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "eventstorming")
public class EventStormingProperties {

    private Storage storage = new Storage();
    private Output output = new Output();

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }

    public static class Storage {
        private String type = "file";
        private String directory = System.getProperty("user.home") + "/.eventstorming_workshops";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public boolean isInMemory() {
            return "memory".equalsIgnoreCase(type);
        }
    }

    public static class Output {
        private int characterLimit = 25000;

        public int getCharacterLimit() { return characterLimit; }
        public void setCharacterLimit(int characterLimit) { this.characterLimit = characterLimit; }
    }
}
