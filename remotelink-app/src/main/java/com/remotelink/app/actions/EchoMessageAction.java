package com.remotelink.app.actions;

import com.remotelink.gateway.command.CommandAction;
import com.remotelink.gateway.command.CommandSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Echoes the request message back; used to check the command path end to end.
 */
@Slf4j
@Component
public class EchoMessageAction implements CommandAction {

    @Override
    public String id() {
        return "echo_message";
    }

    @Override
    public Object run(CommandSpec spec, Map<String, Object> payload) {
        Object message = payload.get("message");
        String text = message == null ? "" : message.toString();
        log.info("Command '{}' says: {}", spec.name(), text);
        return Map.of("message", text);
    }
}
