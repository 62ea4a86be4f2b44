package com.ciro.jcss.standalone;

public class Main {
    public static void main(String[] args) {
        JcssServer server = new JcssServer(ServerConfig.fromArgs(args));
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "jcss-shutdown"));
        server.start();
    }
}
