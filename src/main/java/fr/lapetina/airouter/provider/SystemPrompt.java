package fr.lapetina.airouter.provider;

import fr.lapetina.airouter.domain.model.CanonicalRequest.Message;
import fr.lapetina.airouter.domain.model.CanonicalRequest.Role;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a conversation into a single system prompt and the remaining turns, for vendors
 * that carry the system prompt in a separate field.
 *
 * <p>The first system message is hoisted; later system messages are folded into it in
 * order, separated by a blank line.
 */
public record SystemPrompt(String system, List<Message> conversation) {

    private static final String SEPARATOR = "\n\n";

    public SystemPrompt {
        conversation = List.copyOf(conversation);
    }

    public static SystemPrompt hoist(List<Message> messages) {
        StringBuilder system = null;
        List<Message> conversation = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (message.role() == Role.SYSTEM) {
                if (system == null) {
                    system = new StringBuilder(message.content());
                } else {
                    system.append(SEPARATOR).append(message.content());
                }
            } else {
                conversation.add(message);
            }
        }
        return new SystemPrompt(system != null ? system.toString() : null, conversation);
    }

    public boolean hasSystem() {
        return system != null && !system.isEmpty();
    }
}
