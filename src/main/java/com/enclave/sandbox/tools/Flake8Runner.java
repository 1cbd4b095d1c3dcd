package com.enclave.sandbox.tools;

import com.enclave.sandbox.CommandExecutor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class Flake8Runner extends AbstractToolRunner {

    public Flake8Runner(CommandExecutor executor) {
        super(executor);
    }

    @Override
    public String name() {
        return "flake8";
    }

    @Override
    protected List<String> command() {
        return List.of("python", "-m", "flake8", ".");
    }
}
