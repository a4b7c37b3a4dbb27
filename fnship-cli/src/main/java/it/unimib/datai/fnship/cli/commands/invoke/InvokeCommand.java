package it.unimib.datai.fnship.cli.commands.invoke;

import com.fasterxml.jackson.databind.JsonNode;
import it.unimib.datai.fnship.cli.commands.RootCommand;
import it.unimib.datai.fnship.cli.io.JsonIO;
import it.unimib.datai.fnship.deployer.error.FunctionErrors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "invoke", description = "Invoke a function synchronously and print its JSON result.")
public class InvokeCommand implements Runnable {

    @ParentCommand
    RootCommand root;

    @Parameters(index = "0", description = "Function name")
    String name;

    @Option(names = {"-d", "--data"}, description = "JSON payload, @file, or @- for stdin (default: {}).")
    String data;

    @Override
    public void run() {
        JsonNode payload = JsonIO.readPayload(data);
        JsonNode result = FunctionErrors.await(root.deployer().invoke(name, payload));
        System.out.println(JsonIO.write(result));
    }
}
