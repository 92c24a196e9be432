package cn.edu.bit.vaultsync.handler;

/**
 * 单个 HTTP 字节区间，end 包含在内
 */
record ByteRange(long start, long end, boolean satisfiable) {

    static final ByteRange UNSATISFIABLE = new ByteRange(-1, -1, false);

    long length() {
        return end - start + 1;
    }

    /**
     * 解析 Range 头，支持 bytes=a-b、bytes=a-、bytes=-n
     *
     * @return 无法识别的格式（包括多区间）返回 null，按完整内容响应
     */
    static ByteRange parse(String header, long totalLength) {
        if (header == null || !header.startsWith("bytes=")) {
            return null;
        }
        String spec = header.substring("bytes=".length()).trim();
        int dash = spec.indexOf('-');
        if (dash < 0 || spec.indexOf(',') >= 0) {
            return null;
        }
        String first = spec.substring(0, dash).trim();
        String last = spec.substring(dash + 1).trim();
        try {
            if (first.isEmpty()) {
                if (last.isEmpty()) {
                    return null;
                }
                long suffix = Long.parseLong(last);
                if (suffix <= 0 || totalLength == 0) {
                    return UNSATISFIABLE;
                }
                return new ByteRange(Math.max(0, totalLength - suffix), totalLength - 1, true);
            }
            long start = Long.parseLong(first);
            if (start < 0) {
                return null;
            }
            // 显式的结束位置小于起始位置是语法错误，忽略 Range 头
            if (!last.isEmpty() && Long.parseLong(last) < start) {
                return null;
            }
            if (start >= totalLength) {
                return UNSATISFIABLE;
            }
            long end = last.isEmpty() ? totalLength - 1 : Math.min(Long.parseLong(last), totalLength - 1);
            return new ByteRange(start, end, true);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
