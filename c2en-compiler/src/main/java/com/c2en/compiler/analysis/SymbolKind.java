package com.c2en.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    FUNCTION,           // 函数定义或原型
    VARIABLE,           // 局部或全局变量
    PARAMETER,          // 函数参数
    ENUM_CONSTANT,      // 枚举常量
    TYPE_ALIAS,         // typedef 名
    BUILTIN_CONSTANT    // NULL、EOF 等预定义常量
}
