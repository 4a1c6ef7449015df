package com.mpatric.id3tag;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps the three-character frame IDs of ID3v2.2 to their ID3v2.3/2.4 equivalents.
 */
public final class ID3v22FrameIds {

    private static final Map<String, String> V22_TO_V24;

    static {
        Map<String, String> m = new HashMap<>();
        m.put("BUF", "RBUF");
        m.put("CNT", "PCNT");
        m.put("COM", "COMM");
        m.put("CRA", "AENC");
        m.put("ETC", "ETCO");
        m.put("GEO", "GEOB");
        m.put("IPL", "IPLS");
        m.put("LNK", "LINK");
        m.put("MCI", "MCDI");
        m.put("MLL", "MLLT");
        m.put("PIC", "APIC");
        m.put("POP", "POPM");
        m.put("REV", "RVRB");
        m.put("SLT", "SYLT");
        m.put("STC", "SYTC");
        m.put("TAL", "TALB");
        m.put("TBP", "TBPM");
        m.put("TCM", "TCOM");
        m.put("TCO", "TCON");
        m.put("TCR", "TCOP");
        m.put("TDA", "TDAT");
        m.put("TDY", "TDLY");
        m.put("TEN", "TENC");
        m.put("TFT", "TFLT");
        m.put("TIM", "TIME");
        m.put("TKE", "TKEY");
        m.put("TLA", "TLAN");
        m.put("TLE", "TLEN");
        m.put("TMT", "TMED");
        m.put("TOA", "TOPE");
        m.put("TOF", "TOFN");
        m.put("TOL", "TOLY");
        m.put("TOR", "TORY");
        m.put("TOT", "TOAL");
        m.put("TP1", "TPE1");
        m.put("TP2", "TPE2");
        m.put("TP3", "TPE3");
        m.put("TP4", "TPE4");
        m.put("TPA", "TPOS");
        m.put("TPB", "TPUB");
        m.put("TRC", "TSRC");
        m.put("TRD", "TRDA");
        m.put("TRK", "TRCK");
        m.put("TSI", "TSIZ");
        m.put("TSS", "TSSE");
        m.put("TT1", "TIT1");
        m.put("TT2", "TIT2");
        m.put("TT3", "TIT3");
        m.put("TXT", "TEXT");
        m.put("TXX", "TXXX");
        m.put("TYE", "TYER");
        m.put("UFI", "UFID");
        m.put("ULT", "USLT");
        m.put("WAF", "WOAF");
        m.put("WAR", "WOAR");
        m.put("WAS", "WOAS");
        m.put("WCM", "WCOM");
        m.put("WCP", "WCOP");
        m.put("WPB", "WPUB");
        m.put("WXX", "WXXX");
        V22_TO_V24 = Collections.unmodifiableMap(m);
    }

    private ID3v22FrameIds() {}

    /**
     * @param v22Id a three-character ID3v2.2 frame ID
     * @return the four-character equivalent, or null if the ID is unknown
     */
    public static String toV24(String v22Id) {
        return V22_TO_V24.get(v22Id);
    }

    public static Map<String, String> mappings() {
        return V22_TO_V24;
    }
}
