package com.mpatric.id3tag;

import java.util.ArrayList;
import java.util.List;

public final class ID3v1Genres {

    public static final String[] GENRES = {
            "Blues", "Classic Rock", "Country", "Dance", "Disco", "Funk", "Grunge",
            "Hip-Hop", "Jazz", "Metal", "New Age", "Oldies", "Other", "Pop", "R&B",
            "Rap", "Reggae", "Rock", "Techno", "Industrial", "Alternative", "Ska",
            "Death Metal", "Pranks", "Soundtrack", "Euro-Techno", "Ambient",
            "Trip-Hop", "Vocal", "Jazz+Funk", "Fusion", "Trance", "Classical",
            "Instrumental", "Acid", "House", "Game", "Sound Clip", "Gospel", "Noise",
            "AlternRock", "Bass", "Soul", "Punk", "Space", "Meditative",
            "Instrumental Pop", "Instrumental Rock", "Ethnic", "Gothic", "Darkwave",
            "Techno-Industrial", "Electronic", "Pop-Folk", "Eurodance", "Dream",
            "Southern Rock", "Comedy", "Cult", "Gangsta", "Top 40", "Christian Rap",
            "Pop/Funk", "Jungle", "Native American", "Cabaret", "New Wave",
            "Psychedelic", "Rave", "Showtunes", "Trailer", "Lo-Fi", "Tribal",
            "Acid Punk", "Acid Jazz", "Polka", "Retro", "Musical", "Rock & Roll",
            "Hard Rock", "Folk", "Folk-Rock", "National Folk", "Swing", "Fast Fusion",
            "Bebop", "Latin", "Revival", "Celtic", "Bluegrass", "Avantgarde",
            "Gothic Rock", "Progressive Rock", "Psychedelic Rock", "Symphonic Rock",
            "Slow Rock", "Big Band", "Chorus", "Easy Listening", "Acoustic", "Humour",
            "Speech", "Chanson", "Opera", "Chamber Music", "Sonata", "Symphony",
            "Booty Bass", "Primus", "Porn Groove", "Satire", "Slow Jam", "Club",
            "Tango", "Samba", "Folklore", "Ballad", "Power Ballad", "Rhythmic Soul",
            "Freestyle", "Duet", "Punk Rock", "Drum Solo", "A capella", "Euro-House",
            "Dance Hall", "Goa", "Drum & Bass", "Club-House", "Hardcore Techno",
            "Terror", "Indie", "BritPop", "Negerpunk", "Polsk Punk", "Beat",
            "Christian Gangsta Rap", "Heavy Metal", "Black Metal", "Crossover",
            "Contemporary Christian", "Christian Rock", "Merengue", "Salsa",
            "Thrash Metal", "Anime", "Jpop", "Synthpop", "Abstract", "Art Rock",
            "Baroque", "Bhangra", "Big Beat", "Breakbeat", "Chillout", "Downtempo",
            "Dub", "EBM", "Eclectic", "Electro", "Electroclash", "Emo", "Experimental",
            "Garage", "Global", "IDM", "Illbient", "Industro-Goth", "Jam Band",
            "Krautrock", "Leftfield", "Lounge", "Math Rock", "New Romantic",
            "Nu-Breakz", "Post-Punk", "Post-Rock", "Psytrance", "Shoegaze",
            "Space Rock", "Trop Rock", "World Music", "Neoclassical", "Audiobook",
            "Audio Theatre", "Neue Deutsche Welle", "Podcast", "Indie Rock",
            "G-Funk", "Dubstep", "Garage Rock", "Psybient",
    };

    private ID3v1Genres() {}

    /** @return the genre name, or null if the index is outside the table */
    public static String getGenreName(int index) {
        if (index < 0 || index >= GENRES.length) return null;
        return GENRES[index];
    }

    /** @return the table index of {@code name} (case-insensitive), or -1 */
    public static int indexOf(String name) {
        if (name == null) return -1;
        for (int i = 0; i < GENRES.length; i++) {
            if (GENRES[i].equalsIgnoreCase(name)) return i;
        }
        return -1;
    }

    /**
     * Parses a TCON value into genre names. Understands bare indexes ({@code 17}),
     * parenthesised references ({@code (17)}, {@code (17)Rock}), the codes {@code (RX)}
     * (Remix) and {@code (CR)} (Cover), and null-separated lists. A parenthesised index
     * outside the table becomes {@code Unknown(n)}; a bare one is kept as written.
     */
    public static List<String> parseGenre(String text) {
        List<String> genres = new ArrayList<>();
        if (text == null) return genres;
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return genres;

        String remaining = trimmed;
        while (!remaining.isEmpty()) {
            if (remaining.charAt(0) == '(') {
                int close = remaining.indexOf(')');
                if (close < 0) {
                    genres.add(remaining);
                    break;
                }
                String inner = remaining.substring(1, close);
                remaining = remaining.substring(close + 1);
                if ("RX".equals(inner)) {
                    genres.add("Remix");
                } else if ("CR".equals(inner)) {
                    genres.add("Cover");
                } else if (isIndex(inner)) {
                    String name = lookup(inner);
                    genres.add(name != null ? name : "Unknown(" + Integer.parseInt(inner) + ")");
                } else {
                    genres.add(inner);
                }
            } else {
                for (String part : remaining.split("\0")) {
                    part = part.trim();
                    if (part.isEmpty()) continue;
                    String name = isIndex(part) ? lookup(part) : null;
                    genres.add(name != null ? name : part);
                }
                break;
            }
        }
        if (genres.isEmpty()) genres.add(trimmed);
        return genres;
    }

    private static boolean isIndex(String s) {
        if (s.isEmpty() || s.length() > 9) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    private static String lookup(String index) {
        return getGenreName(Integer.parseInt(index));
    }
}
