package macrorec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.awt.event.KeyEvent;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyboard keys known to the recorder and player.
 *
 * <p>Each constant carries the identifier written to recording files and the
 * {@link KeyEvent} virtual-key code used to synthesize it on replay. Printable
 * keys use their character as identifier ({@code "a"}, {@code "7"}, {@code ";"});
 * special keys use a {@code "Key."} prefix ({@code "Key.enter"}, {@code "Key.shift"}).
 *
 * <p>Identifiers that do not match any constant decode to {@link #UNKNOWN}.
 * {@link KeyPress} keeps the identifier as read, so shifted characters still
 * replay (as shift plus the base key) and are written back unchanged.
 */
public enum Key {

    A("a", KeyEvent.VK_A), B("b", KeyEvent.VK_B), C("c", KeyEvent.VK_C),
    D("d", KeyEvent.VK_D), E("e", KeyEvent.VK_E), F("f", KeyEvent.VK_F),
    G("g", KeyEvent.VK_G), H("h", KeyEvent.VK_H), I("i", KeyEvent.VK_I),
    J("j", KeyEvent.VK_J), K("k", KeyEvent.VK_K), L("l", KeyEvent.VK_L),
    M("m", KeyEvent.VK_M), N("n", KeyEvent.VK_N), O("o", KeyEvent.VK_O),
    P("p", KeyEvent.VK_P), Q("q", KeyEvent.VK_Q), R("r", KeyEvent.VK_R),
    S("s", KeyEvent.VK_S), T("t", KeyEvent.VK_T), U("u", KeyEvent.VK_U),
    V("v", KeyEvent.VK_V), W("w", KeyEvent.VK_W), X("x", KeyEvent.VK_X),
    Y("y", KeyEvent.VK_Y), Z("z", KeyEvent.VK_Z),

    DIGIT_0("0", KeyEvent.VK_0), DIGIT_1("1", KeyEvent.VK_1), DIGIT_2("2", KeyEvent.VK_2),
    DIGIT_3("3", KeyEvent.VK_3), DIGIT_4("4", KeyEvent.VK_4), DIGIT_5("5", KeyEvent.VK_5),
    DIGIT_6("6", KeyEvent.VK_6), DIGIT_7("7", KeyEvent.VK_7), DIGIT_8("8", KeyEvent.VK_8),
    DIGIT_9("9", KeyEvent.VK_9),

    MINUS("-", KeyEvent.VK_MINUS),
    EQUALS("=", KeyEvent.VK_EQUALS),
    OPEN_BRACKET("[", KeyEvent.VK_OPEN_BRACKET),
    CLOSE_BRACKET("]", KeyEvent.VK_CLOSE_BRACKET),
    BACK_SLASH("\\", KeyEvent.VK_BACK_SLASH),
    SEMICOLON(";", KeyEvent.VK_SEMICOLON),
    QUOTE("'", KeyEvent.VK_QUOTE),
    COMMA(",", KeyEvent.VK_COMMA),
    PERIOD(".", KeyEvent.VK_PERIOD),
    SLASH("/", KeyEvent.VK_SLASH),
    BACK_QUOTE("`", KeyEvent.VK_BACK_QUOTE),

    SPACE("Key.space", KeyEvent.VK_SPACE),
    ENTER("Key.enter", KeyEvent.VK_ENTER),
    TAB("Key.tab", KeyEvent.VK_TAB),
    BACKSPACE("Key.backspace", KeyEvent.VK_BACK_SPACE),
    ESCAPE("Key.esc", KeyEvent.VK_ESCAPE),
    DELETE("Key.delete", KeyEvent.VK_DELETE),
    INSERT("Key.insert", KeyEvent.VK_INSERT),
    HOME("Key.home", KeyEvent.VK_HOME),
    END("Key.end", KeyEvent.VK_END),
    PAGE_UP("Key.page_up", KeyEvent.VK_PAGE_UP),
    PAGE_DOWN("Key.page_down", KeyEvent.VK_PAGE_DOWN),
    UP("Key.up", KeyEvent.VK_UP),
    DOWN("Key.down", KeyEvent.VK_DOWN),
    LEFT("Key.left", KeyEvent.VK_LEFT),
    RIGHT("Key.right", KeyEvent.VK_RIGHT),
    CAPS_LOCK("Key.caps_lock", KeyEvent.VK_CAPS_LOCK),
    NUM_LOCK("Key.num_lock", KeyEvent.VK_NUM_LOCK),
    SCROLL_LOCK("Key.scroll_lock", KeyEvent.VK_SCROLL_LOCK),
    PRINT_SCREEN("Key.print_screen", KeyEvent.VK_PRINTSCREEN),
    PAUSE("Key.pause", KeyEvent.VK_PAUSE),
    MENU("Key.menu", KeyEvent.VK_CONTEXT_MENU),

    F1("Key.f1", KeyEvent.VK_F1), F2("Key.f2", KeyEvent.VK_F2), F3("Key.f3", KeyEvent.VK_F3),
    F4("Key.f4", KeyEvent.VK_F4), F5("Key.f5", KeyEvent.VK_F5), F6("Key.f6", KeyEvent.VK_F6),
    F7("Key.f7", KeyEvent.VK_F7), F8("Key.f8", KeyEvent.VK_F8), F9("Key.f9", KeyEvent.VK_F9),
    F10("Key.f10", KeyEvent.VK_F10), F11("Key.f11", KeyEvent.VK_F11), F12("Key.f12", KeyEvent.VK_F12),
    F13("Key.f13", KeyEvent.VK_F13), F14("Key.f14", KeyEvent.VK_F14), F15("Key.f15", KeyEvent.VK_F15),
    F16("Key.f16", KeyEvent.VK_F16), F17("Key.f17", KeyEvent.VK_F17), F18("Key.f18", KeyEvent.VK_F18),
    F19("Key.f19", KeyEvent.VK_F19), F20("Key.f20", KeyEvent.VK_F20),

    SHIFT("Key.shift", KeyEvent.VK_SHIFT),
    CTRL("Key.ctrl", KeyEvent.VK_CONTROL),
    ALT("Key.alt", KeyEvent.VK_ALT),
    CMD("Key.cmd", KeyEvent.VK_META),

    UNKNOWN("unknown", KeyEvent.VK_UNDEFINED);

    private static final Map<String, Key> BY_IDENTIFIER = new HashMap<>();

    /** Characters typed with shift held, mapped to the unshifted key (US layout). */
    private static final Map<String, Key> SHIFTED = new HashMap<>();

    static {
        for (Key key : values()) {
            if (key != UNKNOWN) BY_IDENTIFIER.put(key.identifier, key);
        }
        // Side-specific modifier names collapse onto the canonical modifier
        BY_IDENTIFIER.put("Key.shift_l", SHIFT);
        BY_IDENTIFIER.put("Key.shift_r", SHIFT);
        BY_IDENTIFIER.put("Key.ctrl_l",  CTRL);
        BY_IDENTIFIER.put("Key.ctrl_r",  CTRL);
        BY_IDENTIFIER.put("Key.alt_l",   ALT);
        BY_IDENTIFIER.put("Key.alt_r",   ALT);
        BY_IDENTIFIER.put("Key.alt_gr",  ALT);
        BY_IDENTIFIER.put("Key.cmd_l",   CMD);
        BY_IDENTIFIER.put("Key.cmd_r",   CMD);
        BY_IDENTIFIER.put(" ",           SPACE);

        for (Key key : values()) {
            if (key.identifier.length() == 1 && Character.isLetter(key.identifier.charAt(0))) {
                SHIFTED.put(key.identifier.toUpperCase(Locale.ROOT), key);
            }
        }
        String shiftedDigits = ")!@#$%^&*(";
        for (int d = 0; d <= 9; d++) {
            SHIFTED.put(String.valueOf(shiftedDigits.charAt(d)), BY_IDENTIFIER.get(String.valueOf(d)));
        }
        SHIFTED.put("_",  MINUS);
        SHIFTED.put("+",  EQUALS);
        SHIFTED.put("{",  OPEN_BRACKET);
        SHIFTED.put("}",  CLOSE_BRACKET);
        SHIFTED.put("|",  BACK_SLASH);
        SHIFTED.put(":",  SEMICOLON);
        SHIFTED.put("\"", QUOTE);
        SHIFTED.put("<",  COMMA);
        SHIFTED.put(">",  PERIOD);
        SHIFTED.put("?",  SLASH);
        SHIFTED.put("~",  BACK_QUOTE);
    }

    private final String identifier;
    private final int awtKeyCode;

    Key(String identifier, int awtKeyCode) {
        this.identifier = identifier;
        this.awtKeyCode = awtKeyCode;
    }

    /** Identifier written to recording files. */
    @JsonValue
    public String identifier() { return identifier; }

    /** {@link KeyEvent} virtual-key code, {@link KeyEvent#VK_UNDEFINED} for {@link #UNKNOWN}. */
    public int awtKeyCode() { return awtKeyCode; }

    /**
     * True for the four canonical modifiers (shift, ctrl, alt, cmd). Modifiers
     * bypass keypress de-duplication during replay.
     */
    public boolean isModifier() {
        return this == SHIFT || this == CTRL || this == ALT || this == CMD;
    }

    /**
     * Decodes a recorded identifier. Anything that is not one of the constants'
     * identifiers (or a side-specific modifier name) maps to {@link #UNKNOWN},
     * including upper-case letters and shifted symbols; see {@link #strokesFor}.
     *
     * @param identifier identifier as stored in a recording, may be {@code null}
     */
    @JsonCreator
    public static Key fromIdentifier(String identifier) {
        if (identifier == null) return UNKNOWN;
        return BY_IDENTIFIER.getOrDefault(identifier, UNKNOWN);
    }

    /**
     * Keys to hold down, in order, to produce a recorded identifier: the key
     * itself, or {@code [SHIFT, base]} for an upper-case letter or a shifted
     * symbol such as {@code "!"} or {@code ":"}.
     *
     * @return an empty list if the identifier cannot be typed
     */
    public static List<Key> strokesFor(String identifier) {
        Key key = fromIdentifier(identifier);
        if (key != UNKNOWN) return List.of(key);
        Key base = identifier == null ? null : SHIFTED.get(identifier);
        return base != null ? List.of(SHIFT, base) : List.of();
    }
}
