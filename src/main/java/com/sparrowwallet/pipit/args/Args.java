package com.sparrowwallet.pipit.args;

import com.beust.jcommander.Parameter;

import java.io.File;

public class Args {
    @Parameter(names = { "--dir", "-d" }, description = "Directory holding the host keys and pipit.json")
    public File dir = new File(System.getProperty("user.home"), ".pipit");

    @Parameter(names = { "--host" }, description = "Daemon host, overriding the configured value")
    public String host;

    @Parameter(names = { "--port", "-p" }, description = "Daemon port, overriding the configured value")
    public Integer port;

    @Parameter(names = { "--help", "-h" }, description = "Show this help message and exit", help = true)
    public boolean help;
}
