package com.pbpreminder.bot.check;

public interface Check {

    String label();

    void run(CheckContext ctx);
}
