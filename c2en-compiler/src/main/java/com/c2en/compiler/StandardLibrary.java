package com.c2en.compiler;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 可识别的 C 标准库函数及其英文描述。
 *
 * <p>语义检查把这里的函数视为外部已定义；翻译器用描述代替通用的调用模板。
 * printf 与 strlen 的描述依赖参数，由翻译器单独处理，这里只登记名字。</p>
 */
public final class StandardLibrary {

    private StandardLibrary() {}

    private static final Map<String, String> DESCRIPTIONS;

    static {
        Map<String, String> map = new LinkedHashMap<>();

        // 输入输出
        map.put("printf", null);
        map.put("scanf", "read input from the user");
        map.put("sprintf", "format text and store it in a string");
        map.put("fprintf", "write formatted output to a file");
        map.put("fscanf", "read formatted input from a file");
        map.put("getchar", "read a character from standard input");
        map.put("putchar", "write a character to standard output");
        map.put("puts", "write a string to standard output");
        map.put("gets", "read a string from standard input");

        // 文件
        map.put("fopen", "open a file");
        map.put("fclose", "close an open file");
        map.put("fread", "read data from a file");
        map.put("fwrite", "write data to a file");
        map.put("fgets", "read a line of text from a file");
        map.put("fputs", "write a line of text to a file");
        map.put("feof", "check if end of file has been reached");
        map.put("fseek", "move the file position indicator");
        map.put("ftell", "get the current file position");
        map.put("rewind", "reset the file position to the beginning");

        // 字符串
        map.put("strlen", null);
        map.put("strcpy", "copy one text string to another");
        map.put("strncpy", "copy a specified number of characters from one text string to another");
        map.put("strcmp", "compare two text strings");
        map.put("strncmp", "compare a specified number of characters in two text strings");
        map.put("strcat", "concatenate two text strings");

        // 内存
        map.put("malloc", "allocate memory dynamically");
        map.put("calloc", "allocate and initialise memory to zero");
        map.put("realloc", "resize previously allocated memory");
        map.put("free", "release previously allocated memory");
        map.put("memcpy", "copy a block of memory");
        map.put("memset", "fill a block of memory with a specified value");
        map.put("memcmp", "compare two blocks of memory");

        // 转换
        map.put("atoi", "convert text to an integer");
        map.put("atof", "convert text to a floating-point number");
        map.put("atol", "convert text to a long integer");
        map.put("itoa", "convert an integer to text");

        // 数学
        map.put("abs", "calculate the absolute value");
        map.put("sqrt", "calculate the square root");
        map.put("pow", "raise a number to a power");
        map.put("sin", "calculate the sine");
        map.put("cos", "calculate the cosine");
        map.put("tan", "calculate the tangent");
        map.put("log", "calculate the natural logarithm");
        map.put("exp", "calculate the exponential");
        map.put("ceil", "round up to the nearest integer");
        map.put("floor", "round down to the nearest integer");
        map.put("rand", "generate a pseudo-random number");
        map.put("srand", "seed the random number generator");

        // 其他
        map.put("time", "get the current time");
        map.put("exit", "terminate the programme");
        map.put("assert", "verify a condition and abort if false");
        map.put("isalpha", "check if a character is alphabetic");
        map.put("isdigit", "check if a character is a digit");
        map.put("isspace", "check if a character is whitespace");
        map.put("toupper", "convert a character to uppercase");
        map.put("tolower", "convert a character to lowercase");
        map.put("qsort", "sort an array using quicksort");
        map.put("bsearch", "search a sorted array using binary search");

        DESCRIPTIONS = Collections.unmodifiableMap(map);
    }

    /** 预处理器通常提供的常量名，语义检查视为已声明 */
    private static final Set<String> CONSTANTS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "NULL", "EOF", "stdin", "stdout", "stderr", "RAND_MAX",
            "EXIT_SUCCESS", "EXIT_FAILURE", "true", "false")));

    public static boolean isKnownFunction(String name) {
        return DESCRIPTIONS.containsKey(name);
    }

    /**
     * 固定描述；未登记或描述依赖参数时返回 null
     */
    public static String describe(String name) {
        return DESCRIPTIONS.get(name);
    }

    public static Set<String> functionNames() {
        return DESCRIPTIONS.keySet();
    }

    public static Set<String> constantNames() {
        return CONSTANTS;
    }
}
