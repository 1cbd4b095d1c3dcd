package com.enclave.sandbox.tools;

import com.enclave.sandbox.CommandExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PytestRunner extends AbstractToolRunner {

    public PytestRunner(CommandExecutor executor) {
        super(executor);
    }

    @Override
    public String name() {
        return "pytest";
    }

    @Override
    protected List<String> command() {
        return List.of("python", "-m", "pytest", "-q", "-p", "no:cacheprovider", "--color=no");
    }
}
