package com.remotelink.app.actions;

import com.remotelink.gateway.command.CommandAction;
import com.remotelink.gateway.command.CommandSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;
import java.awt.GraphicsEnvironment;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Shows a message on the client's screen without blocking the request.
 * <p>
 * On a headless JVM (the Spring Boot default) the message is only logged.
 */
@Slf4j
@Component
public class PopupAction implements CommandAction {

    @Override
    public String id() {
        return "popup";
    }

    @Override
    public Object run(CommandSpec spec, Map<String, Object> payload) {
        String message = String.valueOf(payload.getOrDefault("message", ""));
        String title = String.valueOf(payload.getOrDefault("title", "Notification"));
        String type = String.valueOf(payload.getOrDefault("type", "info")).toLowerCase(Locale.ROOT);

        boolean shown = !GraphicsEnvironment.isHeadless();
        if (shown) {
            SwingUtilities.invokeLater(() ->
                    JOptionPane.showMessageDialog(null, message, title, messageType(type)));
        } else {
            log.info("Popup [{}] {}: {}", type, title, message);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("title", title);
        result.put("message", message);
        result.put("type", type);
        result.put("displayed", shown);
        return result;
    }

    static int messageType(String type) {
        return switch (type) {
            case "warning" -> JOptionPane.WARNING_MESSAGE;
            case "error" -> JOptionPane.ERROR_MESSAGE;
            default -> JOptionPane.INFORMATION_MESSAGE;
        };
    }
}
