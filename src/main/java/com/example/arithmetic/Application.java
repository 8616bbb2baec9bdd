package com.example.arithmetic;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.example.arithmetic.util.LazyLogger;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Command line front end evaluating a single arithmetic operation.
 */
@CommandLine.Command(
        name = "arithmetic",
        mixinStandardHelpOptions = true,
        version = "arithmetic 1.0.0",
        description = "Evaluates OPERATION on the operands A and B.",
        exitCodeListHeading = "%nExit codes:%n",
        exitCodeList = {
            "0:Success",
            "1:Division by zero",
            "2:Invalid operation or operand"
        })
public final class Application implements Callable<Integer> {
    static final int EXIT_DIVISION_BY_ZERO = 1;

    private static final LazyLogger LOGGER = new LazyLogger(Application.class);

    @CommandLine.Spec CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
            index = "0",
            paramLabel = "OPERATION",
            description = "One of add, subtract, multiply, divide or the symbols + - * /",
            converter = OperationConverter.class)
    ArithmeticOperation operation;

    @CommandLine.Parameters(
            index = "1",
            paramLabel = "A",
            description = "First operand",
            converter = OperandConverter.class)
    Operand first;

    @CommandLine.Parameters(
            index = "2",
            paramLabel = "B",
            description = "Second operand",
            converter = OperandConverter.class)
    Operand second;

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            description = "Enable debug logging")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Application()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            setRootLogLevel(Level.DEBUG);
        }
        LOGGER.debug(() -> "Evaluating " + first + " " + operation.symbol() + " " + second);
        try {
            Operand result = operation.apply(first, second);
            spec.commandLine().getOut().println(result);
            return CommandLine.ExitCode.OK;
        } catch (DivisionByZeroException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return EXIT_DIVISION_BY_ZERO;
        }
    }

    private static void setRootLogLevel(Level level) {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
    }

    static final class OperationConverter implements CommandLine.ITypeConverter<ArithmeticOperation> {
        @Override
        public ArithmeticOperation convert(String value) {
            try {
                return ArithmeticOperation.fromToken(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    static final class OperandConverter implements CommandLine.ITypeConverter<Operand> {
        @Override
        public Operand convert(String value) {
            try {
                return Operand.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
