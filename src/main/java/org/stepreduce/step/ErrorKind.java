package org.stepreduce.step;

/**
 * 输入错误分类（由输入内容导致的失败，区别于引擎自身缺陷 {@link ReductionDefectException}）。
 */
public enum ErrorKind {

    /**
     * 词法结构不完整：语句缺少 ';'、字符串引号不闭合、注释不闭合等。
     */
    MALFORMED_RECORD,

    /**
     * 实体语法错误：在某个字节偏移处遇到了不符合参数语法的记号。
     */
    UNEXPECTED_TOKEN,

    /**
     * 引用了 DATA 段中不存在的实体 id。
     */
    DANGLING_REFERENCE,

    /**
     * 能识别但不处理的 STEP 语法（例如 ANCHOR/SIGNATURE 段、用户自定义实体、多个 DATA 段）。
     */
    UNSUPPORTED_CONSTRUCT
}
