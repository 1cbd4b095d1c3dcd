package com.enclave.sandbox.tools;

import com.enclave.sandbox.CommandExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class NpmTestRunner extends AbstractToolRunner {

    public NpmTestRunner(CommandExecutor executor) {
        super(executor);
    }

    @Override
    public String name() {
        return "npm-test";
    }

    @Override
    protected List<String> command() {
        return List.of("npm", "test", "--silent");
    }
}
