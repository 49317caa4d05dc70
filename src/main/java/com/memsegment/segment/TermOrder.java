package com.memsegment.segment;

import java.util.Comparator;

/**
 * 词项按 UTF-8 字节序比较。UTF-8 字节序与 Unicode 码点序一致，因此逐码点比较即可。
 */
public final class TermOrder {

    public static final Comparator<String> BYTE_ORDER = TermOrder::compare;

    private TermOrder() {
    }

    public static int compare(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Integer.compare(left.length() - leftIndex, right.length() - rightIndex);
    }
}
