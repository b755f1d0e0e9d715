package io.github.simbo1905.tex.math;

/// What an environment handler sees: the environment name and the live parser.
public record EnvironmentContext(String envName, Parser parser, Mode mode) {
}
