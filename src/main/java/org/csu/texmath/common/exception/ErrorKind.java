package org.csu.texmath.common.exception;

/**
 * 转换失败的种类，对应流水线中的出错阶段。
 */
public enum ErrorKind {
    /** 语法分析阶段：意外的 Token、缺失的 Token 或多余的尾部 Token */
    SYNTAX,
    /** 渲染阶段：非法标识符、未知函数或参数个数错误 */
    FORMAT,
    /** 渲染器缺少对某种节点的处理，属于程序缺陷 */
    INTERNAL
}
