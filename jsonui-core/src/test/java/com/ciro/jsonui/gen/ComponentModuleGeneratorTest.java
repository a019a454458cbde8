package com.ciro.jsonui.gen;

import com.ciro.jsonui.emit.ModuleUsage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComponentModuleGeneratorTest {

    private final ComponentModuleGenerator generator = new ComponentModuleGenerator();

    @Test
    void typescriptComponentFile() {
        String out = generator.generate("Home", "<div />", new ModuleUsage(), OutputFlavor.TYPESCRIPT);
        assertEquals("""
                // Generated by jsonui - do not edit directly
                import React from 'react';
                import type { HomeData } from '@/generated/data/HomeData';

                interface HomeProps {
                  viewModel: { data: HomeData; [key: string]: any };
                }

                export const Home = ({ viewModel }: HomeProps) => {
                  return (
                    <div />
                  );
                };

                export default Home;
                """, out);
    }

    @Test
    void importsFollowUsage() {
        ModuleUsage usage = new ModuleUsage();
        usage.useLink();
        usage.useExtension("Chart");
        usage.useInclude("HeaderBar");
        usage.useInclude("Home");
        String out = generator.generate("Home", "<div />", usage, OutputFlavor.PLAIN);

        assertTrue(out.startsWith("\"use client\";\n\n"));
        assertTrue(out.contains("import Link from 'next/link';\n"));
        assertTrue(out.contains("import { Chart } from '@/components/extensions/Chart';\n"));
        assertTrue(out.contains("import HeaderBar from './HeaderBar';\n"));
        assertFalse(out.contains("import Home from"));
        assertTrue(out.contains("export const Home = ({ viewModel }) => {\n"));
    }

    @Test
    void conditionalRootIsWrappedInFragment() {
        String out = generator.generate("Tip", "{viewModel.data.show && (\n  <span>x</span>\n)}",
                new ModuleUsage(), OutputFlavor.PLAIN);
        assertTrue(out.contains("  return (\n"
                + "    <>\n"
                + "      {viewModel.data.show && (\n"
                + "        <span>x</span>\n"
                + "      )}\n"
                + "    </>\n"
                + "  );\n"));
    }
}
