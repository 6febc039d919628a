package macrorec.player;

import org.testng.annotations.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PlayerConfig}, using the package-private
 * {@code PlayerConfig(Properties)} constructor to avoid classpath I/O.
 */
public class PlayerConfigTest {

    @Test(description = "Speed defaults to 1.0 when properties are empty")
    public void testSpeedDefault() {
        assertThat(new PlayerConfig(new Properties()).getSpeed()).isEqualTo(1.0);
    }

    @Test(description = "Speed is read from player.speed")
    public void testSpeedOverride() {
        Properties p = new Properties();
        p.setProperty("player.speed", " 2.5 ");
        assertThat(new PlayerConfig(p).getSpeed()).isEqualTo(2.5);
    }

    @Test(description = "Unparsable, non-positive and infinite speeds fall back to 1.0")
    public void testInvalidSpeedFallsBack() {
        Properties p = new Properties();
        PlayerConfig cfg = new PlayerConfig(p);

        p.setProperty("player.speed", "double");
        assertThat(cfg.getSpeed()).isEqualTo(1.0);

        cfg.setSpeed(0.0);
        assertThat(cfg.getSpeed()).isEqualTo(1.0);

        cfg.setSpeed(-3.0);
        assertThat(cfg.getSpeed()).isEqualTo(1.0);

        cfg.setSpeed(0.25);
        assertThat(cfg.getSpeed()).isEqualTo(0.25);
    }

    @Test(description = "Classpath config.properties is loaded")
    public void testClasspathLoad() {
        assertThat(new PlayerConfig().getSpeed()).isEqualTo(1.0);
    }
}
