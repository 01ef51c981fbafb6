package com.codewatch.dispatch.cli;

import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: codewatch capabilities
 */
@Command(name = "capabilities", mixinStandardHelpOptions = true,
        description = "List registered review capabilities")
@Component
public class CapabilitiesCommand implements Runnable {

    private final CapabilityRegistry registry;

    public CapabilitiesCommand(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        for (Capability capability : registry.all()) {
            ConsoleOutput.capability(capability.id(), capability.role().name().toLowerCase(),
                    capability.sourceId(), capability.description());
        }
    }
}
