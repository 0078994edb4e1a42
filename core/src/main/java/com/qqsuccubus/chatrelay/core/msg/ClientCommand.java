package com.qqsuccubus.chatrelay.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.qqsuccubus.chatrelay.core.util.JsonUtils;
import lombok.Value;

/**
 * Commands a client may send over its WebSocket, discriminated by the {@code type} property.
 * <p>
 * The set is closed: {@code message}, {@code typing}, {@code edit}, {@code delete}. Anything else
 * is rejected by {@link #decode(String)}.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientCommand.PostMessage.class, name = "message"),
    @JsonSubTypes.Type(value = ClientCommand.SetTyping.class, name = "typing"),
    @JsonSubTypes.Type(value = ClientCommand.EditMessage.class, name = "edit"),
    @JsonSubTypes.Type(value = ClientCommand.DeleteMessage.class, name = "delete")
})
public interface ClientCommand {

    /**
     * Checks required fields after structural decoding.
     *
     * @throws InvalidCommandException if a required field is missing or empty
     */
    void validate();

    /**
     * Decodes and validates one inbound text frame.
     *
     * @param json raw frame payload
     * @return validated command
     * @throws InvalidCommandException on malformed JSON, unknown or missing type, or invalid fields
     */
    static ClientCommand decode(String json) {
        ClientCommand command;
        try {
            command = JsonUtils.readValue(json, ClientCommand.class);
        } catch (InvalidTypeIdException e) {
            throw new InvalidCommandException("Unknown or missing command type: " + e.getTypeId(), e);
        } catch (JsonProcessingException e) {
            throw new InvalidCommandException("Malformed command: " + e.getOriginalMessage(), e);
        }
        if (command == null) {
            throw new InvalidCommandException("Empty command");
        }
        command.validate();
        return command;
    }

    /**
     * {@code {"type":"message","content":"..."}}
     */
    @Value
    class PostMessage implements ClientCommand {
        String content;

        @JsonCreator
        public PostMessage(@JsonProperty("content") String content) {
            this.content = content;
        }

        @Override
        public void validate() {
            if (content == null || content.isEmpty()) {
                throw new InvalidCommandException("message requires non-empty content");
            }
        }
    }

    /**
     * {@code {"type":"typing","isTyping":true}}
     */
    @Value
    class SetTyping implements ClientCommand {
        Boolean typing;

        @JsonCreator
        public SetTyping(@JsonProperty("isTyping") Boolean typing) {
            this.typing = typing;
        }

        @Override
        public void validate() {
            if (typing == null) {
                throw new InvalidCommandException("typing requires isTyping");
            }
        }
    }

    /**
     * {@code {"type":"edit","messageId":"...","content":"..."}}
     */
    @Value
    class EditMessage implements ClientCommand {
        String messageId;
        String content;

        @JsonCreator
        public EditMessage(
            @JsonProperty("messageId") String messageId,
            @JsonProperty("content") String content
        ) {
            this.messageId = messageId;
            this.content = content;
        }

        @Override
        public void validate() {
            if (messageId == null || content == null) {
                throw new InvalidCommandException("edit requires messageId and content");
            }
        }
    }

    /**
     * {@code {"type":"delete","messageId":"..."}}
     */
    @Value
    class DeleteMessage implements ClientCommand {
        String messageId;

        @JsonCreator
        public DeleteMessage(@JsonProperty("messageId") String messageId) {
            this.messageId = messageId;
        }

        @Override
        public void validate() {
            if (messageId == null) {
                throw new InvalidCommandException("delete requires messageId");
            }
        }
    }
}
