package com.remotelink.app.actions;

import com.remotelink.common.infra.SystemInfoProvider;
import com.remotelink.gateway.command.CommandAction;
import com.remotelink.gateway.command.CommandSpec;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class HostSpecsAction implements CommandAction {

    private final SystemInfoProvider systemInfo;

    public HostSpecsAction(SystemInfoProvider systemInfo) {
        this.systemInfo = systemInfo;
    }

    @Override
    public String id() {
        return "host_specs";
    }

    @Override
    public Object run(CommandSpec spec, Map<String, Object> payload) {
        return systemInfo.hostInfo();
    }
}
