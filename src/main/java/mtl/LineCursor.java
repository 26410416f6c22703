package mtl;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/** 单行文本上的读位置；next* 失败时位置不变 */
public final class LineCursor {

    private final String text;
    private int pos;

    public LineCursor(String text){ this.text = text == null ? "" : text; }

    /** 与 C isspace 一致：只认 ASCII 空白 */
    public static boolean isSpace(char c){
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
    }

    public static String trim(String s){
        if (s == null) return "";
        int b = 0, e = s.length();
        while (b < e && isSpace(s.charAt(b))) b++;
        while (e > b && isSpace(s.charAt(e - 1))) e--;
        return s.substring(b, e);
    }

    public int position(){ return pos; }

    public void reset(int position){ pos = position; }

    /** 跳过空白后的下一个字符，行尾返回 0；不移动 */
    public char peek(){
        int i = skipFrom(pos);
        return i < text.length() ? text.charAt(i) : 0;
    }

    /** 下一个空白分隔的 token，没有则返回 "" 且位置不变 */
    public String nextToken(){
        int i = skipFrom(pos);
        int start = i;
        while (i < text.length() && !isSpace(text.charAt(i))) i++;
        if (start == i) return "";
        pos = i;
        return text.substring(start, i);
    }

    /** 下一个 token 是否为本行最后一个 */
    public boolean nextIsLastToken(){
        int mark = pos;
        nextToken();
        boolean last = nextToken().isEmpty();
        pos = mark;
        return last;
    }

    /** 行的剩余部分（已 trim），不移动 */
    public String remainder(){ return trim(text.substring(pos)); }

    public Optional<String> nextWord(){
        String token = nextToken();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /** 最长合法前缀，语义同 strtol */
    public OptionalInt nextInt(){
        int i = skipFrom(pos);
        int start = i;
        if (i < text.length() && (text.charAt(i) == '+' || text.charAt(i) == '-')) i++;
        int digits = i;
        while (i < text.length() && isDigit(text.charAt(i))) i++;
        if (i == digits) return OptionalInt.empty();

        long value;
        try {
            value = Long.parseLong(text.substring(start, i));
        } catch (NumberFormatException overflow) {
            value = text.charAt(start) == '-' ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        pos = i;
        return OptionalInt.of((int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value)));
    }

    /** 最长合法前缀，语义同 strtod（不支持 inf/nan/十六进制） */
    public OptionalDouble nextDouble(){
        int i = skipFrom(pos);
        int start = i;
        if (i < text.length() && (text.charAt(i) == '+' || text.charAt(i) == '-')) i++;
        int digits = 0;
        while (i < text.length() && isDigit(text.charAt(i))) { i++; digits++; }
        if (i < text.length() && text.charAt(i) == '.') {
            int j = i + 1;
            while (j < text.length() && isDigit(text.charAt(j))) { j++; digits++; }
            if (digits > 0) i = j;
        }
        if (digits == 0) return OptionalDouble.empty();

        if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < text.length() && (text.charAt(j) == '+' || text.charAt(j) == '-')) j++;
            if (j < text.length() && isDigit(text.charAt(j))) {
                while (j < text.length() && isDigit(text.charAt(j))) j++;
                i = j;
            }
        }
        double value = Double.parseDouble(text.substring(start, i));
        pos = i;
        return OptionalDouble.of(value);
    }

    private int skipFrom(int i){
        while (i < text.length() && isSpace(text.charAt(i))) i++;
        return i;
    }

    private static boolean isDigit(char c){ return c >= '0' && c <= '9'; }

    @Override public String toString(){ return text.substring(0, pos) + "|" + text.substring(pos); }
}
