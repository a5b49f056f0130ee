package io.hookcron.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

public class ConfigUtil
{
    private ConfigUtil()
    { }

    public static Path defaultConfigPath(Map<String, String> env)
    {
        return hookcronConfigHome(env).resolve("config");
    }

    public static Path hookcronConfigHome(Map<String, String> env)
    {
        String configHomeEnv = env.get("HOOKCRON_CONFIG_HOME");
        if (configHomeEnv != null) {
            return Paths.get(configHomeEnv);
        }
        return configHome(env).resolve("hookcron");
    }

    private static Path configHome(Map<String, String> env)
    {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null) {
            return Paths.get(configHome);
        }
        return Paths.get(System.getProperty("user.home"), ".config");
    }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }
}
