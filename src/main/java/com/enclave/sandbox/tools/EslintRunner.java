package com.enclave.sandbox.tools;

import com.enclave.sandbox.CommandExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EslintRunner extends AbstractToolRunner {

    public EslintRunner(CommandExecutor executor) {
        super(executor);
    }

    @Override
    public String name() {
        return "eslint";
    }

    @Override
    protected List<String> command() {
        return List.of("npx", "--no-install", "eslint", ".");
    }
}
