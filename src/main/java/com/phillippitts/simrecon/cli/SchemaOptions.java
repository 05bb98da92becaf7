package com.phillippitts.simrecon.cli;

import com.phillippitts.simrecon.service.config.ParameterSchema;
import com.phillippitts.simrecon.service.config.ParameterType;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generates one {@code --key} option per schema parameter and reads back the values the user
 * actually gave. Underscores in keys become hyphens in option names.
 */
final class SchemaOptions {

    private SchemaOptions() {
    }

    static String optionName(String key) {
        return "--" + key.replace('_', '-');
    }

    static void register(CommandSpec spec, ParameterSchema schema) {
        for (ParameterSchema.ParameterSpec parameter : schema.specs()) {
            String name = optionName(parameter.key());
            if (spec.findOption(name) != null) {
                continue;
            }
            OptionSpec.Builder option = OptionSpec.builder(name)
                    .type(parameter.type().javaType())
                    .description(parameter.description());
            if (parameter.type() == ParameterType.BOOLEAN) {
                option.arity("0..1");
            } else {
                option.arity("1").paramLabel("<" + parameter.key() + ">");
            }
            spec.addOption(option.build());
        }
    }

    /**
     * @return parameter key to value, for every generated option present on the command line
     */
    static Map<String, Object> collect(CommandSpec spec, ParameterSchema schema) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ParameterSchema.ParameterSpec parameter : schema.specs()) {
            OptionSpec option = spec.findOption(optionName(parameter.key()));
            if (option != null && option.getValue() != null) {
                values.put(parameter.key(), option.getValue());
            }
        }
        return values;
    }
}
