package com.myorg.tocparser.service.processing;

import com.myorg.tocparser.exception.InputContractException;
import com.myorg.tocparser.model.Line;

import java.util.List;

/**
 * Argument checks shared by the pipeline entry points.
 */
public final class InputContracts {

    private InputContracts() {}

    public static <T> List<T> requireList(List<T> list, String name) {
        if (list == null) {
            throw new InputContractException(name + " must not be null");
        }
        return list;
    }

    public static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new InputContractException(name + " must be at least 1, got " + value);
        }
        return value;
    }

    /**
     * Lines must be non-null, carry a line number of at least 1 and appear in non-decreasing
     * page order.
     */
    public static List<Line> requirePageOrdered(List<Line> lines) {
        requireList(lines, "lines");
        int previousPage = Integer.MIN_VALUE;
        for (int i = 0; i < lines.size(); i++) {
            Line line = lines.get(i);
            if (line == null) {
                throw new InputContractException("lines[" + i + "] is null");
            }
            if (line.getLineNumber() < 1) {
                throw new InputContractException("lines[" + i + "] has line number " + line.getLineNumber()
                        + " on page " + line.getPage() + "; line numbers are 1-based");
            }
            if (line.getPage() < previousPage) {
                throw new InputContractException("lines are not page-ordered: page " + line.getPage()
                        + " follows page " + previousPage + " at index " + i);
            }
            previousPage = line.getPage();
        }
        return lines;
    }
}
