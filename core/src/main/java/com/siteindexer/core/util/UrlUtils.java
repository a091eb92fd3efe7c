package com.siteindexer.core.util;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL 문자열 유틸: fragment 제거, 상대 링크 해석, authority/path 추출.
 * URL은 불투명 문자열 키로 다루며 host 소문자화 같은 정규화는 하지 않는다.
 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final String HEX = "0123456789ABCDEF";
    private static final Pattern HEX_DIGIT = Pattern.compile("[0-9A-Fa-f]{2}");
    // unreserved/sub-delims 중 path/query에 허용되는 구두점('#'은 fragment 제거 후라 없음)
    private static final String URI_PUNCT = "-._~!$&'()*+,;=:@/?";

    // RFC 3986 Appendix B
    private static final Pattern URI_PARTS =
            Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?");

    /** '#' 이후 제거. null은 null. */
    public static String stripFragment(String url) {
        if (url == null) return null;
        int i = url.indexOf('#');
        return i < 0 ? url : url.substring(0, i);
    }

    /**
     * href를 현재 문서 URL 기준 절대 URL로 해석(fragment 제거 포함).
     * path/query의 URI 불허 문자(공백, 비ASCII 등)는 UTF-8 퍼센트 인코딩, 기존 %XX는 유지.
     * 해석 불가(알 수 없는 스킴 등)면 null.
     */
    public static String resolve(String base, String href) {
        if (base == null || href == null) return null;
        String rel = stripFragment(href).trim();
        try {
            URL baseUrl = new URL(stripFragment(base));
            // java.net.URL은 "?q" 단독 상대 참조에서 파일명을 잃는다
            if (rel.startsWith("?")) rel = baseUrl.getPath() + rel;
            URL abs = collapseAboveRoot(new URL(baseUrl, rel));
            String ext = stripFragment(abs.toExternalForm());
            String auth = abs.getAuthority();
            int pathStart = abs.getProtocol().length() + 1 + (auth == null || auth.isEmpty() ? 0 : 2 + auth.length());
            return ext.substring(0, pathStart) + encodeIllegal(ext.substring(pathStart));
        } catch (MalformedURLException e) {
            return null;
        }
    }

    /** URI에 그대로 쓸 수 없는 문자만 %XX로. 유효한 %XX 이스케이프는 건드리지 않는다. */
    static String encodeIllegal(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            int n = Character.charCount(cp);
            boolean keep = (cp == '%') ? isEscape(s, i) : isUriChar(cp);
            if (!keep) {
                if (sb == null) sb = new StringBuilder(s.length() + 16).append(s, 0, i);
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append('%').append(HEX.charAt((b >> 4) & 0xF)).append(HEX.charAt(b & 0xF));
                }
            } else if (sb != null) {
                sb.appendCodePoint(cp);
            }
            i += n;
        }
        return sb == null ? s : sb.toString();
    }

    private static boolean isUriChar(int c) {
        if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9') return true;
        return c < 0x80 && URI_PUNCT.indexOf(c) >= 0;
    }

    private static boolean isEscape(String s, int i) {
        return i + 2 < s.length() && HEX_DIGIT.matcher(s.substring(i + 1, i + 3)).matches();
    }

    /** 루트 위로 올라가는 "/../" 세그먼트는 루트로 접는다 */
    private static URL collapseAboveRoot(URL u) throws MalformedURLException {
        String file = u.getFile();
        if (!file.startsWith("/../") && !file.equals("/..")) return u;
        String fixed = file.replaceFirst("^(/\\.\\.)+(?=/|$)", "");
        if (fixed.isEmpty() || fixed.charAt(0) != '/') fixed = "/" + fixed;
        return new URL(u.getProtocol(), u.getHost(), u.getPort(), fixed);
    }

    /** authority(host[:port], userinfo 포함) 원문. 없으면 "" */
    public static String authority(String url) {
        Matcher m = match(url);
        return (m == null || m.group(4) == null) ? "" : m.group(4);
    }

    /** path 원문(퍼센트 인코딩 유지). 없으면 "" */
    public static String path(String url) {
        Matcher m = match(url);
        return (m == null || m.group(5) == null) ? "" : m.group(5);
    }

    public static boolean isAbsolute(String url) {
        Matcher m = match(url);
        return m != null && m.group(2) != null && m.group(3) != null;
    }

    /**
     * 마지막 path 세그먼트의 확장자(점 포함). 세그먼트 앞쪽 점들은 확장자로 보지 않는다.
     * "/a/b.tar.gz" → ".gz", "/a/.hidden" → "", "/dir/" → ""
     */
    public static String extension(String path) {
        if (path == null) return "";
        String name = path.substring(path.lastIndexOf('/') + 1);
        // 마지막 세그먼트의 ;params 는 확장자에 포함하지 않는다
        int semi = name.indexOf(';');
        if (semi >= 0) name = name.substring(0, semi);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) return "";
        for (int i = 0; i < dot; i++) {
            if (name.charAt(i) != '.') return name.substring(dot);
        }
        return "";
    }

    private static Matcher match(String url) {
        if (url == null) return null;
        Matcher m = URI_PARTS.matcher(url);
        return m.matches() ? m : null;
    }
}
