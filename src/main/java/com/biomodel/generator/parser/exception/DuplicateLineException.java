package com.biomodel.generator.parser.exception;

import java.util.List;
import java.util.stream.Collectors;

public class DuplicateLineException extends ModelBuildException {

    private static final long serialVersionUID = 1L;
    private final List<Integer> lineNumbers;

    public DuplicateLineException(String text, List<Integer> lineNumbers) {
        super(lineNumbers.get(0), "Reaction '" + text + "' is duplicated in lines "
                + lineNumbers.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        this.lineNumbers = List.copyOf(lineNumbers);
    }

    public List<Integer> getLineNumbers() {
        return lineNumbers;
    }
}
